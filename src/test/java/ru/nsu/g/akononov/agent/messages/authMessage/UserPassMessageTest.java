package ru.nsu.g.akononov.agent.messages.authMessage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class UserPassMessageTest {

    private static DataInputStream stream(byte... bytes) {
        return new DataInputStream(new ByteArrayInputStream(bytes));
    }

    @Test
    @DisplayName("Should frame username and password with length prefixes")
    void toByteRequest_Framed() {
        byte[] bytes = new UserPassMessage("user", "").toByteRequest();

        assertThat(bytes).containsExactly(0x01, 4, 'u', 's', 'e', 'r', 0);
    }

    @Test
    @DisplayName("Should accept 255 byte fields and reject longer ones")
    void constructor_FieldLengthLimit() {
        String max = "x".repeat(255);
        assertThat(new UserPassMessage(max, max).toByteRequest()).hasSize(3 + 255 + 255);

        assertThatThrownBy(() -> new UserPassMessage("x".repeat(256), "pw"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UserPassMessage("user", "é".repeat(128)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should read the authentication status")
    void readStatus_SuccessAndFailure() throws IOException {
        assertThat(UserPassMessage.readStatus(stream((byte) 0x01, (byte) 0x00))).isTrue();
        assertThat(UserPassMessage.readStatus(stream((byte) 0x01, (byte) 0x01))).isFalse();
        assertThatThrownBy(() -> UserPassMessage.readStatus(stream((byte) 0x05, (byte) 0x00)))
                .hasMessageContaining("unexpected user/pass reply version: 0x05");
    }
}
