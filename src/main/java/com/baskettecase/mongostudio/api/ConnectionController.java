package com.baskettecase.mongostudio.api;

import com.baskettecase.mongostudio.connection.ConnectionProfile;
import com.baskettecase.mongostudio.connection.ConnectionStore;
import com.baskettecase.mongostudio.connection.ConnectionTestResult;
import com.baskettecase.mongostudio.connection.ResolvedConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Connection Controller
 *
 * REST API over the connection store. Passwords are accepted on save and test but never returned.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/connections")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionStore connectionStore;

    @GetMapping
    public List<ConnectionProfile> listConnections() {
        return connectionStore.list();
    }

    /**
     * Profile details plus whether a password is stored for it
     */
    @GetMapping("/{name}")
    public ConnectionDetails getConnection(@PathVariable String name) {
        ResolvedConnection resolved = connectionStore.resolve(name);
        return new ConnectionDetails(resolved.getProfile(), !resolved.getPassword().isEmpty());
    }

    @PostMapping
    public ResponseEntity<ConnectionProfile> saveConnection(@RequestBody SaveConnectionRequest request) {
        ConnectionProfile profile = request.toProfile();
        boolean existed = connectionStore.exists(profile.getName());
        connectionStore.save(profile, request.password());
        return ResponseEntity.status(existed ? HttpStatus.OK : HttpStatus.CREATED).body(profile);
    }

    /**
     * Update a profile. A different name in the body renames it first, moving its password along.
     */
    @PutMapping("/{name}")
    public ConnectionProfile updateConnection(@PathVariable String name, @RequestBody SaveConnectionRequest request) {
        ConnectionProfile profile = request.toProfile();
        if (profile.getName() == null || profile.getName().trim().isEmpty()) {
            profile.setName(name);
        }
        connectionStore.update(name, profile, request.password());
        return profile;
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteConnection(@PathVariable String name) {
        connectionStore.delete(name);
        return ResponseEntity.noContent().build();
    }

    /**
     * Test unsaved settings
     */
    @PostMapping("/test")
    public ConnectionTestResult testConnection(@RequestBody SaveConnectionRequest request) {
        return connectionStore.test(request.toProfile(), request.password());
    }

    /**
     * Test a saved profile with its stored password
     */
    @PostMapping("/{name}/test")
    public ConnectionTestResult testSavedConnection(@PathVariable String name) {
        ResolvedConnection resolved = connectionStore.resolve(name);
        return connectionStore.test(resolved.getProfile(), resolved.getPassword());
    }

    /**
     * Request body for save, update and test
     */
    public record SaveConnectionRequest(
        String name,
        String host,
        Integer port,
        String database,
        String username,
        String password,
        Boolean tls
    ) {
        ConnectionProfile toProfile() {
            return new ConnectionProfile(
                name,
                host,
                port != null ? port : ConnectionProfile.DEFAULT_PORT,
                database,
                username,
                Boolean.TRUE.equals(tls)
            );
        }
    }

    public record ConnectionDetails(
        ConnectionProfile profile,
        boolean passwordStored
    ) {}
}
