package org.speeches.evaluator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class EvaluatorApplicationTest {

    private static MockWebServer sources;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeAll
    static void startSources() throws IOException {
        sources = new MockWebServer();
        sources.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                switch (path) {
                    case "/first.csv":
                        return new MockResponse().setBody("Redner,Thema,Datum,Wörter\n"
                                + "Alexander Abel,Bildungspolitik,2012-10-30,5310\n"
                                + "Bernhard Belling,Kohlesubventionen,2012-11-05,1210\n"
                                + "Caesare Collins,Kohlesubventionen,2012-11-06,1119\n"
                                + "Alexander Abel,Innere Sicherheit,2012-12-11,911\n");
                    case "/second.csv":
                        return new MockResponse().setBody("Redner,Thema,Datum,Wörter\n"
                                + "Bernhard Belling,Bildungspolitik,2013-03-01,900\n"
                                + "Caesare Collins,Bildungspolitik,2013-05-01,100\n"
                                + "Caesare Collins;Bildungspolitik;2013-05-02;100\n");
                    default:
                        return new MockResponse().setResponseCode(404);
                }
            }
        });
        sources.start();
    }

    @AfterAll
    static void stopSources() throws IOException {
        sources.shutdown();
    }

    @Test
    void shouldEvaluateRemoteSources() throws Exception {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/evaluation?url={first}&url={second}&url={missing}",
                String.class,
                sources.url("/first.csv").toString(),
                sources.url("/second.csv").toString(),
                sources.url("/missing.csv").toString());

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = objectMapper.readTree(response.getBody());
        // Belling and Collins both have one speech in 2013
        assertTrue(body.get("mostSpeeches").isNull());
        assertEquals("Alexander Abel", body.get("mostSecurity").asText());
        assertEquals("Caesare Collins", body.get("leastWordy").asText());
        assertEquals(2, body.get("errors").size());
    }

    @Test
    void shouldAnswerBadRequestWithoutSources() {
        ResponseEntity<String> response = restTemplate.getForEntity("/evaluation", String.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }
}
