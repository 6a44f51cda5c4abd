package com.phillippitts.groundstation.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerMessageTest {

    @Test
    void alertOnlyWhenPlayBeforeIsSet() {
        assertThat(new BrokerMessage("hi", null).playAlertBefore()).isFalse();
        assertThat(new BrokerMessage("hi", new BrokerMessage.Alert(false)).playAlertBefore()).isFalse();
        assertThat(new BrokerMessage("hi", new BrokerMessage.Alert(true)).playAlertBefore()).isTrue();
    }

    @Test
    void emptyTextIsAllowed() {
        assertThat(new BrokerMessage("", null).text()).isEmpty();
    }

    @Test
    void nullTextIsRejected() {
        assertThatThrownBy(() -> new BrokerMessage(null, null))
                .isInstanceOf(NullPointerException.class);
    }
}
