package ai.pipestream.s3manager.http;

import java.util.List;

public record ActiveTasksResponse(List<TaskProgressResponse> tasks, int count) {
}
