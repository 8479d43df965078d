package com.myorg.olc.ledger.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerKeysTest {

    @Test
    void entryKeysOfDifferentPairsNeverCollide() {
        assertThat(LedgerKeys.entryKey("order#a::b", "c"))
                .isNotEqualTo(LedgerKeys.entryKey("order#a", "b::c"));
        assertThat(LedgerKeys.entryKey("order#a:1", "x"))
                .isNotEqualTo(LedgerKeys.entryKey("order#a", "1:x"));
        assertThat(LedgerKeys.entryKey("order#a", "b")).isEqualTo(LedgerKeys.entryKey("order#a", "b"));
    }

    @Test
    void indexMemberRoundTripsKeysWithSeparators() {
        LedgerEntry e = new LedgerEntry("order#a::b", "ORDER_CREATED#1", "x@y.io", new ObjectMapper().createObjectNode(), null);

        assertThat(LedgerKeys.splitIndexMember(LedgerKeys.indexMember(e)))
                .containsExactly("ORDER_CREATED#1", "order#a::b");
    }

    @Test
    void keysWithNulAreRejected() {
        assertThatThrownBy(() -> new LedgerEntry("order#a", "b\u0000c", null, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void namespaceIsChecked() {
        assertThatThrownBy(() -> LedgerKeys.requireInNamespace("order", "invoice#1"))
                .isInstanceOf(ValidationException.class);
        assertThat(LedgerKeys.key("order", "o1")).isEqualTo("order#o1");
    }
}
