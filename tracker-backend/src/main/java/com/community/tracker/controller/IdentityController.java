package com.community.tracker.controller;

import com.community.tracker.dto.CommonResponse;
import com.community.tracker.dto.LinkProfileRequest;
import com.community.tracker.dto.PersonDTO;
import com.community.tracker.dto.ProfileDTO;
import com.community.tracker.dto.RegisterPersonRequest;
import com.community.tracker.service.IdentityService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/persons")
public class IdentityController {

    private final IdentityService identityService;

    public IdentityController(IdentityService identityService) {
        this.identityService = identityService;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<PersonDTO>> registerPerson(@Valid @RequestBody RegisterPersonRequest request) {
        PersonDTO person = identityService.registerPerson(request.getExternalUserId(), request.getDisplayName());
        return ResponseEntity.ok(CommonResponse.success(person));
    }

    @GetMapping("/{personId}")
    public ResponseEntity<CommonResponse<PersonDTO>> getPerson(@PathVariable("personId") Long personId) {
        return ResponseEntity.ok(CommonResponse.success(identityService.getPerson(personId)));
    }

    @GetMapping("/external/{externalUserId}")
    public ResponseEntity<CommonResponse<PersonDTO>> findByExternalUserId(@PathVariable("externalUserId") Long externalUserId) {
        return ResponseEntity.ok(CommonResponse.success(identityService.findByExternalUserId(externalUserId)));
    }

    @PutMapping("/{personId}/profile")
    public ResponseEntity<CommonResponse<PersonDTO>> linkProfile(@PathVariable("personId") Long personId,
                                                                 @Valid @RequestBody LinkProfileRequest request) {
        PersonDTO person = identityService.linkProfile(personId, request.getExternalHandle());
        return ResponseEntity.ok(CommonResponse.success(person));
    }

    @GetMapping("/{personId}/profile")
    public ResponseEntity<CommonResponse<ProfileDTO>> getProfile(@PathVariable("personId") Long personId) {
        return ResponseEntity.ok(CommonResponse.success(identityService.getProfile(personId)));
    }

    @DeleteMapping("/{personId}/profile")
    public ResponseEntity<CommonResponse<Void>> unlinkProfile(@PathVariable("personId") Long personId) {
        identityService.unlinkProfile(personId);
        return ResponseEntity.ok(CommonResponse.success());
    }
}
