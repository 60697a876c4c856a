package com.timebox.trigger.http;

import com.timebox.api.dto.DependencyCreateRequestDTO;
import com.timebox.api.dto.TaskDependenciesDTO;
import com.timebox.api.response.Response;
import com.timebox.trigger.application.command.TaskDependencyGraphApplicationService;
import com.timebox.trigger.application.common.TaskWorkflowViewAssembler;
import com.timebox.types.enums.ResponseCode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 任务依赖 API。
 */
@RestController
@RequestMapping("/api/tasks/{id}/dependencies")
public class TaskDependencyController {

    private final TaskDependencyGraphApplicationService dependencyGraphService;
    private final TaskWorkflowViewAssembler assembler;

    public TaskDependencyController(TaskDependencyGraphApplicationService dependencyGraphService,
                                    TaskWorkflowViewAssembler assembler) {
        this.dependencyGraphService = dependencyGraphService;
        this.assembler = assembler;
    }

    @GetMapping
    public Response<TaskDependenciesDTO> list(@PathVariable("id") Long taskId) {
        return success(assembler.toDependenciesDTO(dependencyGraphService.getDependencies(taskId)));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Response<TaskDependenciesDTO> add(@PathVariable("id") Long taskId,
                                             @RequestBody DependencyCreateRequestDTO request) {
        dependencyGraphService.addDependency(taskId, request.getDependsOnTaskId());
        return success(assembler.toDependenciesDTO(dependencyGraphService.getDependencies(taskId)));
    }

    @DeleteMapping("/{dependsOnId}")
    public Response<Void> remove(@PathVariable("id") Long taskId,
                                 @PathVariable("dependsOnId") Long dependsOnTaskId) {
        dependencyGraphService.removeDependency(taskId, dependsOnTaskId);
        return success(null);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
