package com.myorg.olc.invoice.audit;

import com.myorg.olc.contracts.audit.AuditEvent;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingAuditBus implements AuditBus {

    @Override
    public void publish(AuditEvent event) {
        log.info("Audit source={} detailType={} detail={}", event.getSource(), event.getDetailType(), event.getDetail());
    }
}
