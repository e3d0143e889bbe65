package fun.ai.functions.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * 异常 -> HTTP 状态码映射，错误体统一为 {"error": {"message": "..."}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AppNotFoundException.class)
    public ResponseEntity<Result> handleAppNotFound(AppNotFoundException e) {
        return error(HttpStatus.NOT_FOUND.value(), e.getMessage());
    }

    @ExceptionHandler(AppConflictException.class)
    public ResponseEntity<Result> handleAppConflict(AppConflictException e) {
        return error(HttpStatus.CONFLICT.value(), e.getMessage());
    }

    @ExceptionHandler(AppHasRoutesException.class)
    public ResponseEntity<Result> handleAppHasRoutes(AppHasRoutesException e) {
        return error(HttpStatus.FORBIDDEN.value(), e.getMessage());
    }

    /**
     * 上游 functions 平台错误：透传平台状态码与原因（无状态码按 500）
     */
    @ExceptionHandler(FunctionsApiException.class)
    public ResponseEntity<Result> handleFunctionsApi(FunctionsApiException e) {
        return error(e.statusOrDefault(), e.reasonOrDefault());
    }

    @ExceptionHandler(AppProvisioningException.class)
    public ResponseEntity<Result> handleProvisioning(AppProvisioningException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR.value(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST.value(), message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Result> handleBadRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST.value(), e.getMessage());
    }

    /**
     * 路由不存在：不要被兜底成 500
     */
    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<Result> handleNotFound(Exception e) {
        String msg = (e == null || e.getMessage() == null) ? "Not Found" : e.getMessage();
        return error(HttpStatus.NOT_FOUND.value(), msg);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result> handleException(Exception e) {
        logger.error("unhandled error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR.value(), String.valueOf(e.getMessage()));
    }

    private ResponseEntity<Result> error(int status, String message) {
        return ResponseEntity.status(status).body(Result.error(message));
    }
}
