package com.phillippitts.modeestimator.presentation.controller;

import com.phillippitts.modeestimator.domain.ModeResult;
import com.phillippitts.modeestimator.service.ModeEstimationService;
import com.phillippitts.modeestimator.service.ModeOperation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON endpoints for the three estimate operations.
 *
 * <p>Request body: {@code {"values": [1, null, 2], "removeMissing": false, "firstKnown": true}}
 * where JSON {@code null} marks a missing entry and both flags are optional.
 * An undetermined estimate is a normal 200 response with {@code determined=false}.
 * JSON integers are read as {@code Long} whatever their magnitude.
 */
@RestController
@RequestMapping("/api/mode")
class ModeController {

    private static final Logger log = LogManager.getLogger(ModeController.class);

    private final ModeEstimationService service;

    ModeController(ModeEstimationService service) {
        this.service = service;
    }

    @PostMapping("/first")
    ResponseEntity<ModeResponse> first(@RequestBody ModeRequest request) {
        return estimate(ModeOperation.FIRST, request);
    }

    @PostMapping("/all")
    ResponseEntity<ModeResponse> all(@RequestBody ModeRequest request) {
        return estimate(ModeOperation.ALL, request);
    }

    @PostMapping("/single")
    ResponseEntity<ModeResponse> single(@RequestBody ModeRequest request) {
        return estimate(ModeOperation.SINGLE, request);
    }

    private ResponseEntity<ModeResponse> estimate(ModeOperation operation, ModeRequest request) {
        int size = request.values() == null ? 0 : request.values().size();
        log.info("Mode estimate requested: operation={}, size={}", operation.tag(), size);
        ModeResult<Object> result = service.estimate(operation, widenIntegers(request.values()),
                request.removeMissing(), request.firstKnown());
        return ResponseEntity.ok(new ModeResponse(operation.tag(), result.isDetermined(), result.values()));
    }

    // Jackson picks Integer or Long per value depending on magnitude
    private static List<Object> widenIntegers(List<Object> values) {
        if (values == null) {
            return null;
        }
        List<Object> widened = new ArrayList<>(values.size());
        for (Object value : values) {
            widened.add(value instanceof Integer i ? Long.valueOf(i) : value);
        }
        return widened;
    }

    /**
     * Estimate request; {@code null} entries in {@code values} are missing values.
     */
    record ModeRequest(List<Object> values, Boolean removeMissing, Boolean firstKnown) {}

    /**
     * Estimate response; {@code modes} is empty when {@code determined} is false.
     */
    record ModeResponse(String operation, boolean determined, List<Object> modes) {}
}
