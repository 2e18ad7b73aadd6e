package com.agentarena.gateway.http;

import com.agentarena.ledger.CorruptLedgerException;
import com.agentarena.ledger.UnknownCapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ArenaExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ArenaExceptionHandler.class);

    @ExceptionHandler(UnknownCapabilityException.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(UnknownCapabilityException ex) {
        var body = body("unknown_capability", ex.getMessage());
        body.put("capability", ex.capabilityName());
        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CorruptLedgerException.class)
    public ResponseEntity<Map<String, Object>> handleCorrupt(CorruptLedgerException ex) {
        log.error("Write refused: {}", ex.getMessage());
        var body = body("ledger_corrupt", ex.getMessage());
        body.put("problems", ex.problems());
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return new ResponseEntity<>(body("invalid_argument", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    private static Map<String, Object> body(String error, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", details);
        return body;
    }
}
