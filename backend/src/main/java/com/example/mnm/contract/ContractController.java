package com.example.mnm.contract;

import com.example.mnm.dto.ContractDtos.RatingRequest;
import com.example.mnm.dto.ContractDtos.RatingResponse;
import com.example.mnm.dto.ContractDtos.StatusChangeRequest;
import com.example.mnm.dto.ContractDtos.StatusChangeResponse;
import com.example.mnm.security.AuthenticatedUser;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/contracts", "/api/contracts"})
public class ContractController {

    private final ContractLifecycleService lifecycleService;

    public ContractController(ContractLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<StatusChangeResponse> changeStatus(Authentication authentication,
                                                             @PathVariable String id,
                                                             @RequestBody StatusChangeRequest payload) {
        return ResponseEntity.ok(lifecycleService.changeStatus(id, payload.status(),
                AuthenticatedUser.from(authentication)));
    }

    @PutMapping({"/{id}/avaliar", "/{id}/rating"})
    public ResponseEntity<RatingResponse> rate(Authentication authentication,
                                               @PathVariable String id,
                                               @RequestBody RatingRequest payload) {
        return ResponseEntity.ok(lifecycleService.rate(id, payload.rating(), payload.comment(),
                AuthenticatedUser.from(authentication)));
    }
}
