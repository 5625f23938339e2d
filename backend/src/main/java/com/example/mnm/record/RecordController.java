package com.example.mnm.record;

import com.example.mnm.access.ResourceCollection;
import com.example.mnm.exceptions.RecordNotFoundException;
import com.example.mnm.security.AuthenticatedUser;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * CRUD surface of every {@link ResourceCollection}. Query parameters of a listing are
 * field-equality filters.
 */
@RestController
@RequestMapping("/{collection:" + ResourceCollection.PATH_PATTERN + "}")
public class RecordController {

    private final RecordService records;

    public RecordController(RecordService records) {
        this.records = records;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> list(Authentication authentication,
                                                          @PathVariable String collection,
                                                          @RequestParam Map<String, String> filter) {
        return ResponseEntity.ok(records.list(resolve(collection), filter, AuthenticatedUser.from(authentication)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(Authentication authentication,
                                                   @PathVariable String collection,
                                                   @PathVariable String id) {
        return ResponseEntity.ok(records.get(resolve(collection), id, AuthenticatedUser.from(authentication)));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(Authentication authentication,
                                                      @PathVariable String collection,
                                                      @RequestBody Map<String, Object> payload) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(records.create(resolve(collection), payload, AuthenticatedUser.from(authentication)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> replace(Authentication authentication,
                                                       @PathVariable String collection,
                                                       @PathVariable String id,
                                                       @RequestBody Map<String, Object> payload) {
        return ResponseEntity.ok(records.replace(resolve(collection), id, payload,
                AuthenticatedUser.from(authentication)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Map<String, Object>> patch(Authentication authentication,
                                                     @PathVariable String collection,
                                                     @PathVariable String id,
                                                     @RequestBody Map<String, Object> payload) {
        return ResponseEntity.ok(records.patch(resolve(collection), id, payload,
                AuthenticatedUser.from(authentication)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(Authentication authentication,
                                                      @PathVariable String collection,
                                                      @PathVariable String id) {
        records.delete(resolve(collection), id, AuthenticatedUser.from(authentication));
        return ResponseEntity.ok(Map.of());
    }

    private ResourceCollection resolve(String collection) {
        return ResourceCollection.fromPath(collection)
                .orElseThrow(() -> new RecordNotFoundException("collections", collection));
    }
}
