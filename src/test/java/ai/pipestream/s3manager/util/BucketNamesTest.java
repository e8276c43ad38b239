package ai.pipestream.s3manager.util;

import ai.pipestream.s3manager.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BucketNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"abc", "my-bucket", "logs.2026", "a1b2c3"})
    void acceptsValidNames(String name) {
        assertThat(BucketNames.isValid(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab", "-bucket", "bucket-", "Bucket", "my_bucket", "a..b", "192.168.1.1"})
    void rejectsInvalidNames(String name) {
        assertThat(BucketNames.isValid(name)).isFalse();
    }

    @Test
    void rejectsNamesLongerThan63Characters() {
        assertThat(BucketNames.isValid("a".repeat(63))).isTrue();
        assertThat(BucketNames.isValid("a".repeat(64))).isFalse();
    }

    @Test
    void validateReportsTheField() {
        assertThatThrownBy(() -> BucketNames.validate("deleteBucket", " "))
                .isInstanceOfSatisfying(InvalidRequestException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo("VALIDATION_ERROR");
                    assertThat(e.getOperation()).isEqualTo("deleteBucket");
                    assertThat(e.getDetail()).contains("bucket_name");
                });
    }
}
