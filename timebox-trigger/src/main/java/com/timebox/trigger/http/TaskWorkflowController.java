package com.timebox.trigger.http;

import com.timebox.api.dto.BulkCreateRequestDTO;
import com.timebox.api.dto.BulkCreateResponseDTO;
import com.timebox.api.dto.TaskBreakdownRequestDTO;
import com.timebox.api.dto.TaskBreakdownResponseDTO;
import com.timebox.api.dto.TaskMergeRequestDTO;
import com.timebox.api.dto.TaskMergeResponseDTO;
import com.timebox.api.response.Response;
import com.timebox.trigger.application.command.TaskBreakdownApplicationService;
import com.timebox.trigger.application.command.TaskBulkCreateApplicationService;
import com.timebox.trigger.application.command.TaskMergeApplicationService;
import com.timebox.trigger.application.common.TaskWorkflowViewAssembler;
import com.timebox.types.enums.ResponseCode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 任务工作流 API：拆分、合并、批量创建。
 */
@RestController
@RequestMapping("/api/workflow/tasks")
public class TaskWorkflowController {

    private final TaskBreakdownApplicationService breakdownApplicationService;
    private final TaskMergeApplicationService mergeApplicationService;
    private final TaskBulkCreateApplicationService bulkCreateApplicationService;
    private final TaskWorkflowViewAssembler assembler;

    public TaskWorkflowController(TaskBreakdownApplicationService breakdownApplicationService,
                                  TaskMergeApplicationService mergeApplicationService,
                                  TaskBulkCreateApplicationService bulkCreateApplicationService,
                                  TaskWorkflowViewAssembler assembler) {
        this.breakdownApplicationService = breakdownApplicationService;
        this.mergeApplicationService = mergeApplicationService;
        this.bulkCreateApplicationService = bulkCreateApplicationService;
        this.assembler = assembler;
    }

    @PostMapping("/breakdown")
    public Response<TaskBreakdownResponseDTO> breakdown(@RequestBody TaskBreakdownRequestDTO request) {
        TaskBreakdownApplicationService.BreakdownResult result = breakdownApplicationService.breakdown(
                request.getTaskId(),
                assembler.toSubtaskDrafts(request.getSubtasks()),
                request.getReason(),
                !Boolean.FALSE.equals(request.getArchiveOriginal()));
        return success(assembler.toBreakdownResponseDTO(result));
    }

    @PostMapping("/merge")
    public Response<TaskMergeResponseDTO> merge(@RequestBody TaskMergeRequestDTO request) {
        TaskMergeApplicationService.MergeResult result = mergeApplicationService.merge(
                request.getTaskIds(),
                assembler.toMergedDraft(request.getMergedTask()),
                request.getReason());
        return success(assembler.toMergeResponseDTO(result));
    }

    @PostMapping("/bulk-create")
    @ResponseStatus(HttpStatus.CREATED)
    public Response<BulkCreateResponseDTO> bulkCreate(@RequestBody BulkCreateRequestDTO request) {
        TaskBulkCreateApplicationService.BulkCreateResult result = bulkCreateApplicationService.bulkCreate(
                request.getProjectId(),
                assembler.toTaskDrafts(request.getTasks()));
        return success(assembler.toBulkCreateResponseDTO(result));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
