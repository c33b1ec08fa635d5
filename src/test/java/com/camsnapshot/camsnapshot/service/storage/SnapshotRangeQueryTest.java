package com.camsnapshot.camsnapshot.service.storage;

import com.camsnapshot.camsnapshot.exception.BackendFaultException;
import com.camsnapshot.camsnapshot.exception.SnapshotNotFoundException;
import com.camsnapshot.camsnapshot.model.dto.SnapshotEntry;
import org.junit.jupiter.api.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SnapshotRangeQueryTest {

    private static final String SEAWEEDFS = "http://seaweedfs:8888";
    private static final Instant FROM = Instant.parse("2024-03-05T10:42:00Z");
    private static final String TAGS_JSON =
            "{\"Path\":\"/cam1/snapshots\",\"Subdirectories\":[{\"Name\":\"recordings\"},{\"Name\":\"archives\"}]}";

    private MockRestServiceServer server;
    private SnapshotRangeQuery rangeQuery;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        SeaweedFsClient client = new SeaweedFsClient(restTemplate, restTemplate, SEAWEEDFS);
        rangeQuery = new SnapshotRangeQuery(new SnapshotAddressResolver("/storage"), client, 3600);
    }

    @Test
    void testLoadRange_AllTagsInTheHour() {
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/"))
                .andRespond(withSuccess(TAGS_JSON, MediaType.APPLICATION_JSON));
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/recordings/2024/03/05/10/?limit=3600"))
                .andRespond(withSuccess("{\"Files\":[{\"name\":\"00_01_000.jpg\"},{\"name\":\"59_59_999.jpg\"}]}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/archives/2024/03/05/10/?limit=3600"))
                .andRespond(withSuccess("{\"Files\":[{\"name\":\"30_00_000.jpg\"}]}", MediaType.APPLICATION_JSON));

        List<SnapshotEntry> entries = rangeQuery.loadRange("cam1", FROM);

        assertEquals(3, entries.size());
        assertEquals(Instant.parse("2024-03-05T10:00:01Z"), entries.get(0).getCreatedAt());
        assertEquals("Proxy", entries.get(0).getNotes());
        assertNull(entries.get(0).getMotionLevel());
        assertEquals(Instant.parse("2024-03-05T10:59:59Z"), entries.get(1).getCreatedAt());
        assertEquals("User Created", entries.get(2).getNotes());
        server.verify();
    }

    @Test
    void testLoadRange_FailingTagContributesNothing() {
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/"))
                .andRespond(withSuccess(TAGS_JSON, MediaType.APPLICATION_JSON));
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/recordings/2024/03/05/10/?limit=3600"))
                .andRespond(withServerError());
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/archives/2024/03/05/10/?limit=3600"))
                .andRespond(withSuccess("{\"Files\":[{\"name\":\"30_00_000.jpg\"}]}", MediaType.APPLICATION_JSON));

        List<SnapshotEntry> entries = rangeQuery.loadRange("cam1", FROM);

        assertEquals(1, entries.size());
        assertEquals("User Created", entries.get(0).getNotes());
    }

    @Test
    void testLoadRange_EmptyHourDirectory() {
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/"))
                .andRespond(withSuccess("{\"Subdirectories\":[{\"Name\":\"recordings\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/recordings/2024/03/05/10/?limit=3600"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(rangeQuery.loadRange("cam1", FROM).isEmpty());
    }

    @Test
    void testLoadRange_UnknownCameraIsNotFound() {
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThrows(SnapshotNotFoundException.class, () -> rangeQuery.loadRange("cam1", FROM));
    }

    @Test
    void testLoadRange_TopLevelFaultIsRaised() {
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/")).andRespond(withServerError());

        assertThrows(BackendFaultException.class, () -> rangeQuery.loadRange("cam1", FROM));
    }

    @Test
    void testLoadRange_MalformedListingIsAFault() {
        server.expect(requestTo(SEAWEEDFS + "/cam1/snapshots/"))
                .andRespond(withSuccess("not json", MediaType.TEXT_PLAIN));

        assertThrows(BackendFaultException.class, () -> rangeQuery.loadRange("cam1", FROM));
    }
}
