package com.example.dbjobs.controller;

import com.example.dbjobs.exception.ConfigurationException;
import com.example.dbjobs.exception.ConnectionException;
import com.example.dbjobs.exception.JobAlreadyRunningException;
import com.example.dbjobs.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.sql.SQLException;
import java.util.Map;

/**
 * 领域异常 -> HTTP 状态码
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> configuration(ConfigurationException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ResourceNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(JobAlreadyRunningException.class)
    public ResponseEntity<Map<String, String>> conflict(JobAlreadyRunningException e) {
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, String>> staleUpdate(OptimisticLockingFailureException e) {
        log.warn("并发修改冲突: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, "The job was modified concurrently, reload and try again");
    }

    @ExceptionHandler({ConnectionException.class, SQLException.class})
    public ResponseEntity<Map<String, String>> upstream(Exception e) {
        log.warn("目标库访问失败: {}", e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<Map<String, String>> unsupported(UnsupportedOperationException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
