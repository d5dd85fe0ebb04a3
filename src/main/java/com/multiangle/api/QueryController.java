package com.multiangle.api;

import com.multiangle.orchestration.OrchestratorService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class QueryController {

    private final OrchestratorService orchestratorService;

    public QueryController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping({"/api/query", "/query"})
    public QueryResponse query(@Valid @RequestBody QueryRequest request) {
        var result = orchestratorService.orchestrate(request.query(), request.provider(), request.model());
        return QueryResponse.from(result);
    }
}
