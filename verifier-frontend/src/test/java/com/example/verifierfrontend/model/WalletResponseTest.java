package com.example.verifierfrontend.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WalletResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parsesEnvelope() throws Exception {
        WalletResponse response = WalletResponse.fromJson(
                objectMapper.readTree("{\"state\":\"st\",\"response\":\"eyJhbGciOi...\"}"), objectMapper);

        assertThat(response.state()).isEqualTo("st");
        assertThat(response.response()).isEqualTo("eyJhbGciOi...");
    }

    @Test
    void requiresResponse() {
        assertThatThrownBy(() -> WalletResponse.fromJson(objectMapper.readTree("{\"state\":\"st\"}"), objectMapper))
                .isInstanceOf(Exception.class);
        assertThatThrownBy(() -> new WalletResponse(null, "  ")).isInstanceOf(IllegalArgumentException.class);
    }

}
