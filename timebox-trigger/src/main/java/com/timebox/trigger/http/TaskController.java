package com.timebox.trigger.http;

import com.timebox.api.dto.TaskPatchRequestDTO;
import com.timebox.api.dto.TaskSummaryDTO;
import com.timebox.api.response.Response;
import com.timebox.trigger.application.command.TaskUpdateApplicationService;
import com.timebox.trigger.application.common.TaskWorkflowViewAssembler;
import com.timebox.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 任务局部更新 API。
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskUpdateApplicationService taskUpdateApplicationService;
    private final TaskWorkflowViewAssembler assembler;

    public TaskController(TaskUpdateApplicationService taskUpdateApplicationService,
                          TaskWorkflowViewAssembler assembler) {
        this.taskUpdateApplicationService = taskUpdateApplicationService;
        this.assembler = assembler;
    }

    @PatchMapping("/{id}")
    public Response<TaskSummaryDTO> patch(@PathVariable("id") Long taskId, @RequestBody TaskPatchRequestDTO request) {
        return Response.<TaskSummaryDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(assembler.toTaskSummaryDTO(taskUpdateApplicationService.patch(taskId, assembler.toPatch(request))))
                .build();
    }
}
