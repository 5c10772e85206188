package com.example.verifierfrontend.service.adapter;

import com.example.verifierfrontend.model.Nonce;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class UuidNonceGeneratorTest {

    @Test
    void generatesDistinctUuids() {
        UuidNonceGenerator generator = new UuidNonceGenerator();

        Nonce first = generator.generate();
        Nonce second = generator.generate();

        assertThat(UUID.fromString(first.value())).isNotNull();
        assertThat(first).isNotEqualTo(second);
    }

}
