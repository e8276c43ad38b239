package ai.pipestream.s3manager.s3;

import ai.pipestream.s3manager.exception.ObjectStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteBucketResponse;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for S3ObjectStore against a mocked asynchronous client.
 */
@ExtendWith(MockitoExtension.class)
class S3ObjectStoreTest {

    @Mock
    private S3AsyncClient s3;

    private S3ObjectStore store;

    @BeforeEach
    void setUp() {
        store = new S3ObjectStore(s3);
    }

    @Test
    void listMapsObjectsAndContinuationToken() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(CompletableFuture.completedFuture(
                ListObjectsV2Response.builder()
                        .contents(S3Object.builder().key("a").size(10L).build(),
                                S3Object.builder().key("b").size(20L).build())
                        .isTruncated(true)
                        .nextContinuationToken("next-page")
                        .build()));

        ObjectPage page = store.list("photos", "2026/", null, 2);

        assertThat(page.objects()).containsExactly(new ObjectSummary("a", 10L), new ObjectSummary("b", 20L));
        assertThat(page.continuationToken()).isEqualTo("next-page");

        ArgumentCaptor<ListObjectsV2Request> request = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3).listObjectsV2(request.capture());
        assertThat(request.getValue().bucket()).isEqualTo("photos");
        assertThat(request.getValue().prefix()).isEqualTo("2026/");
        assertThat(request.getValue().maxKeys()).isEqualTo(2);
    }

    @Test
    void lastPageHasNoToken() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(CompletableFuture.completedFuture(
                ListObjectsV2Response.builder().isTruncated(false).build()));

        ObjectPage page = store.list("photos", null, "token", 100);

        assertThat(page.objects()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    @DisplayName("Keys reported in the error list fail individually, the rest count as deleted")
    void batchDeleteSeparatesPerKeyFailures() {
        when(s3.deleteObjects(any(DeleteObjectsRequest.class))).thenReturn(CompletableFuture.completedFuture(
                DeleteObjectsResponse.builder()
                        .errors(S3Error.builder().key("b").code("AccessDenied").message("Access Denied").build())
                        .build()));

        BatchDeleteResult result = store.deleteBatch("photos", List.of("a", "b", "c"));

        assertThat(result.deleted()).containsExactly("a", "c");
        assertThat(result.failures()).containsEntry("b", "AccessDenied: Access Denied");

        ArgumentCaptor<DeleteObjectsRequest> request = ArgumentCaptor.forClass(DeleteObjectsRequest.class);
        verify(s3).deleteObjects(request.capture());
        assertThat(request.getValue().delete().quiet()).isTrue();
        assertThat(request.getValue().delete().objects()).hasSize(3);
    }

    @Test
    void emptyBatchMakesNoCall() {
        assertThat(store.deleteBatch("photos", List.of()).deleted()).isEmpty();
        verify(s3, never()).deleteObjects(any(DeleteObjectsRequest.class));
    }

    @Test
    void bucketNotEmptyIsTranslated() {
        when(s3.deleteBucket(any(DeleteBucketRequest.class))).thenReturn(CompletableFuture.failedFuture(
                s3Error(409, "BucketNotEmpty", "The bucket you tried to delete is not empty")));

        assertThatThrownBy(() -> store.deleteBucket("photos"))
                .isInstanceOfSatisfying(ObjectStoreException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(ObjectStoreException.Reason.BUCKET_NOT_EMPTY);
                    assertThat(e.getOperation()).isEqualTo("deleteBucket");
                });
    }

    @Test
    void deleteBucketSucceeds() {
        when(s3.deleteBucket(any(DeleteBucketRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(DeleteBucketResponse.builder().build()));

        store.deleteBucket("photos");

        verify(s3).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void translatesErrorClasses() {
        assertThat(S3ObjectStore.translate(NoSuchBucketException.builder().message("gone").build(), "listObjects", "b")
                .getReason()).isEqualTo(ObjectStoreException.Reason.NOT_FOUND);
        assertThat(S3ObjectStore.translate(s3Error(404, "NoSuchBucket", "gone"), "listObjects", "b")
                .getErrorCode()).isEqualTo("NOT_FOUND");
        assertThat(S3ObjectStore.translate(s3Error(403, "AccessDenied", "denied"), "listObjects", "b")
                .getErrorCode()).isEqualTo("ACCESS_DENIED");
        assertThat(S3ObjectStore.translate(s3Error(500, "InternalError", "oops"), "listObjects", "b")
                .getErrorCode()).isEqualTo("STORE_UNAVAILABLE");
        assertThat(S3ObjectStore.translate(SdkClientException.create("connection refused"), "listObjects", "b")
                .getErrorCode()).isEqualTo("STORE_UNAVAILABLE");
    }

    @Test
    void transportFailureOnListIsUnavailable() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(CompletableFuture.failedFuture(SdkClientException.create("connection refused")));

        assertThatThrownBy(() -> store.list("photos", null, null, 10))
                .isInstanceOfSatisfying(ObjectStoreException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(ObjectStoreException.Reason.UNAVAILABLE);
                    assertThat(e.getDetail()).contains("connection refused");
                    assertThat(e.getCause()).isInstanceOf(SdkClientException.class);
                });
    }

    private static S3Exception s3Error(int status, String code, String message) {
        return (S3Exception) S3Exception.builder()
                .statusCode(status)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(message).build())
                .message(message)
                .build();
    }
}
