package com.strata.policy;

import com.strata.domain.ThresholdProfile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/threshold-profiles")
public class ThresholdProfileController {

    private final ThresholdProfileService profileService;

    public ThresholdProfileController(ThresholdProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    public List<ThresholdProfile> listProfiles() {
        return profileService.findAll();
    }

    @GetMapping("/{profileId}")
    public ThresholdProfile getProfile(@PathVariable Long profileId) {
        return profileService.get(profileId);
    }

    @PostMapping
    public ResponseEntity<ThresholdProfile> createProfile(@RequestBody ThresholdProfile profile) {
        return ResponseEntity.status(HttpStatus.CREATED).body(profileService.create(profile));
    }

    @PutMapping("/{profileId}")
    public ThresholdProfile updateProfile(@PathVariable Long profileId, @RequestBody ThresholdProfile profile) {
        return profileService.update(profileId, profile);
    }

    @DeleteMapping("/{profileId}")
    public ResponseEntity<Void> deleteProfile(@PathVariable Long profileId) {
        profileService.delete(profileId);
        return ResponseEntity.noContent().build();
    }
}
