package io.github.vevoly.datastore.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionTest {

    @Test
    void builderStoresTypeName() {
        Transaction t = Transaction.builder().id("FHIC0000000001").type(TransactionType.SWIFT_SENT).build();

        assertThat(t.getTypeName()).isEqualTo("SWIFT_SENT");
        assertThat(t.getType()).isEqualTo(TransactionType.SWIFT_SENT);
        assertThat(t.isKnownType()).isTrue();
        assertThat(t.isDebit()).isTrue();
    }

    @Test
    @DisplayName("未知类型保留原文且校验通过 / an unknown type keeps its name and still validates")
    void unknownTypeIsKept() {
        Transaction t = Transaction.builder()
                .id("FHIC0000000001")
                .typeName("GIFT_CARD_REDEMPTION")
                .amount(new BigDecimal("100"))
                .resultingBalance(new BigDecimal("700"))
                .build();

        t.validate();
        assertThat(t.getType()).isNull();
        assertThat(t.isKnownType()).isFalse();
        assertThat(t.isCredit()).isFalse();
        assertThat(t.toDisplayLine()).contains("GIFT_CARD_REDEMPTION");
        assertThat(t.toBuilder().build().getTypeName()).isEqualTo("GIFT_CARD_REDEMPTION");
    }

    @Test
    void missingTypeFailsValidation() {
        Transaction t = Transaction.builder()
                .id("FHIC0000000001")
                .amount(BigDecimal.ONE)
                .resultingBalance(BigDecimal.ONE)
                .build();

        assertThatThrownBy(t::validate).isInstanceOf(IllegalStateException.class).hasMessageContaining("no type");
    }
}
