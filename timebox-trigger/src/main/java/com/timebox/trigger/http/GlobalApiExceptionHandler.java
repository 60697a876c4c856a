package com.timebox.trigger.http;

import com.timebox.api.response.Response;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理：业务码决定响应体，ResponseCode 上登记的状态码决定 HTTP 状态。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        ResponseCode responseCode = ResponseCode.fromCode(code);
        String info = StringUtils.defaultIfBlank(ex.getInfo(), responseCode.getInfo());
        if (responseCode.getHttpStatus() >= 500) {
            log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    ex.getClass().getSimpleName(), code, info);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    ex.getClass().getSimpleName(), code, info);
        }
        return ResponseEntity.status(responseCode.getHttpStatus())
                .body(Response.<Object>builder()
                        .code(code)
                        .info(info)
                        .build());
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()), 300);
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ex.getClass().getSimpleName(), ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
        return ResponseEntity.status(ResponseCode.ILLEGAL_PARAMETER.getHttpStatus())
                .body(Response.<Object>builder()
                        .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                        .info(info)
                        .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ex.getClass().getSimpleName(), ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage(), 300), ex);
        return ResponseEntity.status(ResponseCode.UN_ERROR.getHttpStatus())
                .body(Response.<Object>builder()
                        .code(ResponseCode.UN_ERROR.getCode())
                        .info(ResponseCode.UN_ERROR.getInfo())
                        .build());
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
