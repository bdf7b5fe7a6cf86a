package com.flagship.stream_ledger.registry;

import com.flagship.stream_ledger.stream.StreamPersistenceService;
import com.flagship.stream_ledger.stream.dto.StreamResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only registry endpoints.
 */
@RestController
@RequestMapping("/api/registry")
@RequiredArgsConstructor
public class RegistryController {

    private final RegistryService registryService;
    private final StreamPersistenceService streamPersistenceService;

    @GetMapping
    public ResponseEntity<RegistryStats> getStats() {
        return ResponseEntity.ok(registryService.getStats());
    }

    @GetMapping("/categories/{category}")
    public ResponseEntity<List<StreamResponse>> listByCategory(@PathVariable("category") String category) {
        List<StreamResponse> streams = streamPersistenceService
            .findAllInOrder(registryService.getStreamIdsInCategory(category))
            .stream()
            .map(StreamResponse::from)
            .toList();
        return ResponseEntity.ok(streams);
    }
}
