package com.geico.poc.cargoquery;

import com.geico.poc.cargoquery.dto.CompileResponse;
import com.geico.poc.cargoquery.dto.QueryRequest;
import com.geico.poc.cargoquery.dto.QueryResponse;
import com.geico.poc.cargoquery.storage.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    @Autowired
    private QueryService queryService;

    @PostMapping("/execute")
    public ResponseEntity<QueryResponse> executeQuery(@RequestBody QueryRequest request) {
        try {
            QueryResponse response = queryService.execute(request.toSpec());
            if (response.getError() != null) {
                return ResponseEntity.badRequest().body(response);
            }
            return ResponseEntity.ok(response);
        } catch (QueryExecutionException e) {
            log.error("Query execution failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(QueryResponse.error(e.getMessage()));
        }
    }

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compileQuery(@RequestBody QueryRequest request) {
        CompileResponse response = queryService.compile(request.toSpec());
        if (response.getError() != null) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
