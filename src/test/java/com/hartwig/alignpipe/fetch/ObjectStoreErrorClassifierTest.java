package com.hartwig.alignpipe.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class ObjectStoreErrorClassifierTest {

    @Test
    void forbiddenIsAuthenticationFailure() {
        var lines = List.of("Traceback (most recent call last):",
                "  File \"s3am\", line 1",
                "boto.exception.S3ResponseError: S3ResponseError: 403 Forbidden",
                "");
        assertThat(ObjectStoreErrorClassifier.classify(lines)).isEqualTo(FetchFailure.AUTH_FORBIDDEN);
    }

    @Test
    void badRequestIsKeyMismatch() {
        var lines = List.of("boto.exception.S3ResponseError: S3ResponseError: 400 Bad Request");
        assertThat(ObjectStoreErrorClassifier.classify(lines)).isEqualTo(FetchFailure.BAD_REQUEST_OR_KEY_MISMATCH);
    }

    @Test
    void otherBotoErrorIsServiceError() {
        var lines = List.of("boto.exception.S3ResponseError: S3ResponseError: 500 Internal Server Error");
        assertThat(ObjectStoreErrorClassifier.classify(lines)).isEqualTo(FetchFailure.SERVICE_ERROR);
    }

    @Test
    void missingObjectIsResourceMissing() {
        var lines = List.of("AttributeError: 'NoneType' object has no attribute 'size'");
        assertThat(ObjectStoreErrorClassifier.classify(lines)).isEqualTo(FetchFailure.RESOURCE_MISSING);
    }

    @Test
    void otherAttributeErrorIsServiceError() {
        var lines = List.of("AttributeError: 'Bucket' object has no attribute 'foo'");
        assertThat(ObjectStoreErrorClassifier.classify(lines)).isEqualTo(FetchFailure.SERVICE_ERROR);
    }

    @Test
    void emptyOrUnknownOutputIsUnclassified() {
        assertThat(ObjectStoreErrorClassifier.classify(List.of())).isEqualTo(FetchFailure.UNCLASSIFIED);
        assertThat(ObjectStoreErrorClassifier.classify(List.of("", "  "))).isEqualTo(FetchFailure.UNCLASSIFIED);
        assertThat(ObjectStoreErrorClassifier.classify(List.of("Connection reset by peer"))).isEqualTo(FetchFailure.UNCLASSIFIED);
    }

    @Test
    void onlyUnclassifiedIsTransient() {
        for (FetchFailure failure : FetchFailure.values()) {
            assertThat(failure.isTransient()).isEqualTo(failure == FetchFailure.UNCLASSIFIED);
        }
    }
}
