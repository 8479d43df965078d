package com.myorg.olc.contracts.invoice;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceRecord {
    private String invoiceNumber;
    private String customerName;
    private BigDecimal totalValue;
    private String productId;
    private int quantity;
}
