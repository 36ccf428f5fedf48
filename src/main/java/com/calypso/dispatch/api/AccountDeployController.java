package com.calypso.dispatch.api;

import com.calypso.deploy.AccountDeployManager;
import com.calypso.deploy.AccountDeployRequest;
import com.calypso.deploy.DeploymentProviderException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for deploying a project into the caller's own hosting account.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/deploy")
public class AccountDeployController {

    static final String INVALID_TOKEN = "Invalid hosting token. Please check your access token.";

    private final AccountDeployManager accountDeployManager;

    public AccountDeployController(AccountDeployManager accountDeployManager) {
        this.accountDeployManager = accountDeployManager;
    }

    /**
     * POST /deploy/vercel: Deploy the latest complete build with the token in the body.
     */
    @PostMapping("/vercel")
    public ResponseEntity<?> deploy(@PathVariable String projectId,
                                    @RequestBody(required = false) AccountDeployRequest request) {
        if (request == null || request.token() == null || request.token().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Hosting access token is required"));
        }
        try {
            return ResponseEntity.ok(accountDeployManager.deploy(projectId, request));
        } catch (DeploymentProviderException e) {
            if (e.isAuthFailure()) {
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", INVALID_TOKEN));
            }
            return DeployErrors.toResponse(e);
        } catch (RuntimeException e) {
            return DeployErrors.toResponse(e);
        }
    }
}
