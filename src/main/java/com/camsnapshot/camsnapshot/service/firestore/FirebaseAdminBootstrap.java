package com.camsnapshot.camsnapshot.service.firestore;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Initialises the Firebase Admin SDK once at startup. Without credentials the service
 * still starts; repositories then refuse to run and liveness, snapshot rows and
 * retention lookups log their failures.
 */
@Configuration
public class FirebaseAdminBootstrap {

    private static final Logger log = LoggerFactory.getLogger(FirebaseAdminBootstrap.class);
    private static final String CREDENTIALS_ENV = "GOOGLE_APPLICATION_CREDENTIALS";

    private final ResourceLoader resourceLoader;
    private final String credentialsPath;
    private volatile boolean initialized = false;

    public FirebaseAdminBootstrap(ResourceLoader resourceLoader,
                                  @Value("${firebase.credentials.path:}") String credentialsPath) {
        this.resourceLoader = resourceLoader;
        this.credentialsPath = credentialsPath;
    }

    @PostConstruct
    public void init() {
        if (!FirebaseApp.getApps().isEmpty()) {
            initialized = true;
            return;
        }

        List<String> candidates = credentialCandidates();
        Optional<Resource> credentials = candidates.stream()
                .map(resourceLoader::getResource)
                .filter(Resource::exists)
                .findFirst();
        if (credentials.isEmpty()) {
            log.warn("Firestore disabled: no service account found (tried {})", candidates);
            return;
        }

        try (InputStream in = credentials.get().getInputStream()) {
            FirebaseApp.initializeApp(FirebaseOptions.builder()
                    .setCredentials(GoogleCredentials.fromStream(in))
                    .build());
            initialized = true;
            log.info("Firebase Admin SDK initialized from {}", credentials.get());
        } catch (IOException | IllegalStateException e) {
            log.warn("Firestore disabled: initialization from {} failed: {}", credentials.get(), e.getMessage(), e);
        }
    }

    public boolean isInitialized() {
        boolean ok = initialized || !FirebaseApp.getApps().isEmpty();
        if (!ok) {
            log.warn("Firestore is not initialized, skipping operation");
        }
        return ok;
    }

    private List<String> credentialCandidates() {
        List<String> candidates = new ArrayList<>();
        if (credentialsPath != null && !credentialsPath.isBlank()) {
            candidates.add(credentialsPath);
        }
        String env = System.getenv(CREDENTIALS_ENV);
        if (env != null && !env.isBlank()) {
            candidates.add(env.startsWith("file:") ? env : "file:" + env);
        }
        return candidates;
    }
}
