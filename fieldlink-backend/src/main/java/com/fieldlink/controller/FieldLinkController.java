package com.fieldlink.controller;

import com.fieldlink.api.QueryResponse;
import com.fieldlink.resolver.GraphResolver;
import com.fieldlink.resolver.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class FieldLinkController {

    private static final Logger log = LoggerFactory.getLogger(FieldLinkController.class);

    private final GraphResolver graphResolver;

    public FieldLinkController(GraphResolver graphResolver) {
        this.graphResolver = graphResolver;
    }

    /**
     * Resolve all field values linked to the given ones.
     *
     * GET /query?user_id=42&amp;email=a@x.com
     *
     * <p>Always answers 200; a failed resolution is reported through {@code success=false}.
     * A field given more than once is rejected, since a seed carries exactly one value.
     *
     * @param params known field values, one value per field
     * @return discovered values per field, each list sorted
     */
    @GetMapping("/query")
    public ResponseEntity<QueryResponse> query(@RequestParam MultiValueMap<String, String> params) {
        Map<String, String> seeds = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> param : params.entrySet()) {
            if (param.getValue().size() > 1) {
                String message = "field `" + param.getKey() + "` is given more than once";
                log.warn("Query rejected: {}", message);
                return ResponseEntity.ok(QueryResponse.failure(message));
            }
            seeds.put(param.getKey(), param.getValue().isEmpty() ? "" : param.getValue().get(0));
        }
        log.info("Query: seeds={}", seeds.keySet());
        ResolutionResult result = graphResolver.resolve(seeds);
        return ResponseEntity.ok(QueryResponse.from(result));
    }
}
