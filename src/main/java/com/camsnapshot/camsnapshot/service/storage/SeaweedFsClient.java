package com.camsnapshot.camsnapshot.service.storage;

import com.camsnapshot.camsnapshot.exception.BackendFaultException;
import com.camsnapshot.camsnapshot.exception.SnapshotNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the SeaweedFS filer HTTP API.
 *
 * <p>A 404 is reported as {@link SnapshotNotFoundException}; every other failure,
 * including timeouts and refused connections, is a {@link BackendFaultException}.
 */
@Component
public class SeaweedFsClient {

    private static final Logger log = LoggerFactory.getLogger(SeaweedFsClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RestTemplate uploadRestTemplate;
    private final RestTemplate downloadRestTemplate;
    private final String baseUrl;

    public SeaweedFsClient(
            @Qualifier("seaweedfsUploadRestTemplate") RestTemplate uploadRestTemplate,
            @Qualifier("seaweedfsDownloadRestTemplate") RestTemplate downloadRestTemplate,
            @Value("${snapshot.seaweedfs.url:http://localhost:8888}") String baseUrl) {
        this.uploadRestTemplate = uploadRestTemplate;
        this.downloadRestTemplate = downloadRestTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /** Multipart POST, creates the file. */
    public void upload(String path, byte[] image) {
        send(HttpMethod.POST, path, image);
    }

    /** Multipart PUT, replaces an existing file. */
    public void replace(String path, byte[] image) {
        send(HttpMethod.PUT, path, image);
    }

    public boolean exists(String path) {
        try {
            uploadRestTemplate.exchange(uri(path), HttpMethod.HEAD, null, Void.class);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (HttpStatusCodeException e) {
            throw new BackendFaultException("HEAD " + path + " failed", e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new BackendFaultException("HEAD " + path + " failed: " + e.getMessage(), e);
        }
    }

    public byte[] download(String path) {
        ResponseEntity<byte[]> response = get(path, byte[].class);
        byte[] body = response.getBody();
        return body != null ? body : new byte[0];
    }

    public List<String> listSubdirectories(String directory) {
        return listNames(directory, "Subdirectories", "Name");
    }

    public List<String> listFiles(String directory, int limit) {
        return listNames(directory + "?limit=" + limit, "Files", "name");
    }

    private List<String> listNames(String path, String field, String nameField) {
        String body = get(path, String.class).getBody();
        JsonNode entries;
        try {
            entries = MAPPER.readTree(body == null ? "" : body).path(field);
        } catch (JsonProcessingException e) {
            throw new BackendFaultException("Unparseable listing for " + path, e);
        }
        if (!entries.isArray()) {
            throw new BackendFaultException("Listing for " + path + " has no " + field + " array", HttpStatus.OK.value());
        }

        List<String> names = new ArrayList<>();
        for (JsonNode entry : entries) {
            String name = entry.path(nameField).asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private <T> ResponseEntity<T> get(String path, Class<T> type) {
        try {
            ResponseEntity<T> response = downloadRestTemplate.exchange(uri(path), HttpMethod.GET, null, type);
            if (response.getStatusCode().value() != HttpStatus.OK.value()) {
                throw new BackendFaultException("GET " + path + " returned " + response.getStatusCode(),
                        response.getStatusCode().value());
            }
            return response;
        } catch (HttpClientErrorException.NotFound e) {
            throw new SnapshotNotFoundException("Not found in SeaweedFS: " + path);
        } catch (HttpStatusCodeException e) {
            throw new BackendFaultException("GET " + path + " failed", e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new BackendFaultException("GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    private void send(HttpMethod method, String path, byte[] image) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add(path, new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return fileName;
            }
        });

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        try {
            uploadRestTemplate.exchange(uri(path), method, new HttpEntity<>(body, headers), Void.class);
            log.debug("{} {} ({} bytes)", method, path, image.length);
        } catch (HttpStatusCodeException e) {
            throw new BackendFaultException(method + " " + path + " failed", e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new BackendFaultException(method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }
}
