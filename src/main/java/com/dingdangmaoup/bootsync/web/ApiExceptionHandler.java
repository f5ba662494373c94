package com.dingdangmaoup.bootsync.web;

import com.dingdangmaoup.bootsync.coordination.DistributedLock;
import com.dingdangmaoup.bootsync.layout.StorageConfigException;
import com.dingdangmaoup.bootsync.layout.UnappliableLayoutException;
import com.dingdangmaoup.bootsync.resource.NotFoundException;
import com.dingdangmaoup.bootsync.storage.LocalStoreAllocationFailException;
import com.dingdangmaoup.bootsync.storage.LocalStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain errors to HTTP statuses; the body carries the exception message as is
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(LocalStoreAllocationFailException.class)
    public ResponseEntity<ErrorResponse> handleAllocationFail(LocalStoreAllocationFailException e) {
        log.error("Image storage is full: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "no_space", e);
    }

    @ExceptionHandler(LocalStoreException.class)
    public ResponseEntity<ErrorResponse> handleLocalStore(LocalStoreException e) {
        log.warn("Rejected boot resource upload: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid_upload", e);
    }

    @ExceptionHandler(StorageConfigException.class)
    public ResponseEntity<ErrorResponse> handleStorageConfig(StorageConfigException e) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_storage_layout", e);
    }

    @ExceptionHandler(UnappliableLayoutException.class)
    public ResponseEntity<ErrorResponse> handleUnappliableLayout(UnappliableLayoutException e) {
        return respond(HttpStatus.BAD_REQUEST, "unappliable_storage_layout", e);
    }

    @ExceptionHandler(DistributedLock.LockException.class)
    public ResponseEntity<ErrorResponse> handleLock(DistributedLock.LockException e) {
        log.warn("Lock not acquired: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "locked", e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, e.getMessage()));
    }
}
