package com.hartwig.alignpipe.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.hartwig.alignpipe.workflow.LogicalFileKey;

import org.junit.jupiter.api.Test;

class HandleSerializerTest {

    @Test
    void handleIsWrittenAsPlainJson() throws IOException {
        var handle = DurableHandle.builder()
                .key(LogicalFileKey.of("S1", "variants.gatk"))
                .location("gs://bucket/S1/variants.gatk/variants.gatk.vcf")
                .fileName("variants.gatk.vcf")
                .sizeBytes(42)
                .build();
        var json = new String(HandleSerializer.toJson(handle), StandardCharsets.UTF_8);
        assertThat(json).contains("\"sample\":\"S1\"").contains("\"role\":\"variants.gatk\"").contains("\"sizeBytes\":42");
        assertThat(HandleSerializer.fromJson(json.getBytes(StandardCharsets.UTF_8))).isEqualTo(handle);
    }
}
