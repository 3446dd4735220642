package com.demo.churn.controller;

import com.demo.churn.controller.dto.PredictionDtos.PredictionResponse;
import com.demo.churn.controller.dto.PredictionDtos.ValidationResponse;
import com.demo.churn.exception.EncodingException;
import com.demo.churn.exception.PredictionException;
import com.demo.churn.exception.RecordValidationException;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.service.ChurnScoringService;
import com.demo.churn.service.dto.ScoringOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/predictions")
@RequiredArgsConstructor
public class PredictionController {

    private final ChurnScoringService scoring;

    /** Scores and explains one customer. */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public PredictionResponse predict(@RequestBody CustomerRecord record,
                                      @RequestParam(defaultValue = "en") String locale) {
        ScoringOutcome outcome = scoring.score(record, locale);
        if (outcome.isSuccess()) {
            return PredictionResponse.from(outcome);
        }
        switch (outcome.getFailure()) {
            case VALIDATION:
                throw new RecordValidationException(outcome.getError(), outcome.getViolations());
            case ENCODING:
                throw new EncodingException(outcome.getError());
            default:
                throw new PredictionException(outcome.getError());
        }
    }

    /** Validation only, for forms that check input before submitting. */
    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ValidationResponse validate(@RequestBody CustomerRecord record) {
        return ValidationResponse.from(scoring.validate(record));
    }
}
