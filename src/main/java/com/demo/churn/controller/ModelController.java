package com.demo.churn.controller;

import com.demo.churn.service.dto.ImportanceComparison;
import com.demo.churn.service.explain.ExplainService;
import com.demo.churn.service.model.ChurnClassifier;
import com.demo.churn.service.model.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/model")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistry models;
    private final ExplainService explainer;

    @GetMapping
    public Map<String, Object> info() {
        return describe(models.get());
    }

    /** Loads the artifact again. On failure the previous model keeps serving (503 is returned). */
    @PostMapping("/reload")
    public Map<String, Object> reload() {
        return describe(models.reload());
    }

    @GetMapping("/importance")
    public ImportanceComparison importance(@RequestParam(defaultValue = "20") int sample) {
        return explainer.importance(sample);
    }

    private Map<String, Object> describe(ChurnClassifier c) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("version", c.version());
        out.put("type", c.type());
        out.put("features", c.features());
        out.put("generation", models.generation());
        out.put("exactExplanations", explainer.isExact());
        return out;
    }
}
