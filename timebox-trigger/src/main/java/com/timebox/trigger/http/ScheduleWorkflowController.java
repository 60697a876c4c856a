package com.timebox.trigger.http;

import com.timebox.api.dto.WeeklyScheduleRequestDTO;
import com.timebox.api.dto.WeeklyScheduleResponseDTO;
import com.timebox.api.response.Response;
import com.timebox.trigger.application.command.WeeklyScheduleApplicationService;
import com.timebox.trigger.application.common.TaskWorkflowViewAssembler;
import com.timebox.types.enums.ResponseCode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 周排程生成 API。
 */
@RestController
@RequestMapping("/api/workflow/schedule")
public class ScheduleWorkflowController {

    private final WeeklyScheduleApplicationService weeklyScheduleApplicationService;
    private final TaskWorkflowViewAssembler assembler;

    public ScheduleWorkflowController(WeeklyScheduleApplicationService weeklyScheduleApplicationService,
                                      TaskWorkflowViewAssembler assembler) {
        this.weeklyScheduleApplicationService = weeklyScheduleApplicationService;
        this.assembler = assembler;
    }

    @PostMapping("/generate-weekly")
    @ResponseStatus(HttpStatus.CREATED)
    public Response<WeeklyScheduleResponseDTO> generateWeekly(@RequestBody WeeklyScheduleRequestDTO request) {
        WeeklyScheduleApplicationService.WeeklyScheduleResult result = weeklyScheduleApplicationService.generateWeekly(
                request.getWeekStart(),
                assembler.toPreferences(request.getPreferences()),
                assembler.toFixedEvents(request.getFixedEvents()),
                !Boolean.FALSE.equals(request.getClearExisting()));
        return Response.<WeeklyScheduleResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(assembler.toWeeklyScheduleResponseDTO(result))
                .build();
    }
}
