package io.dsla.rag.retrieval;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint exposing the retrieval engine to collaborators. The engine is
 * not thread safe, so searches share a read lock and every mutation takes the
 * write lock.
 */
@RestController
@RequestMapping(path = "/api/rag")
@Validated
public class RetrievalController {

    private final RetrievalEngine retrievalEngine;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public RetrievalController(RetrievalEngine retrievalEngine) {
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
    }

    @PostMapping(path = "/add", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> add(@Valid @RequestBody AddDocumentsRequest request) {
        lock.writeLock().lock();
        try {
            retrievalEngine.add(request.documents(), request.metadata());
        } finally {
            lock.writeLock().unlock();
        }
        return Map.of("status", "added", "count", request.documents().size());
    }

    @PostMapping(path = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SearchResponse search(@Valid @RequestBody SearchRequest request) {
        lock.readLock().lock();
        try {
            return SearchResponse.of(retrievalEngine.search(request.query(), request.topKOrDefault()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @PostMapping("/save")
    public Map<String, Object> save() throws IOException {
        lock.writeLock().lock();
        try {
            retrievalEngine.save();
        } finally {
            lock.writeLock().unlock();
        }
        return Map.of("status", "saved");
    }

    @PostMapping("/clear")
    public Map<String, Object> clear() {
        lock.writeLock().lock();
        try {
            retrievalEngine.clear();
        } finally {
            lock.writeLock().unlock();
        }
        return Map.of("status", "cleared");
    }

    @GetMapping("/status")
    public RetrievalStatus status() {
        lock.readLock().lock();
        try {
            return RetrievalStatus.of(retrievalEngine);
        } finally {
            lock.readLock().unlock();
        }
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }
}
