package software.amazon.event.automaton;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.BeforeClass;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static software.amazon.event.automaton.AutomatonFixtures.quoted;

/**
 * Runs the regexps in regexp-samples.json through both matching engines.
 */
public class RegexpSamplesTest {

    private static JsonNode samples;

    @BeforeClass
    public static void loadSamples() throws IOException {
        try (InputStream in = RegexpSamplesTest.class.getResourceAsStream("/regexp-samples.json")) {
            assertNotNull("regexp-samples.json is missing", in);
            samples = new ObjectMapper().readTree(in);
        }
        assertTrue(samples.isArray() && samples.size() > 0);
    }

    @Test
    public void testSamplesWithDeterminization() {
        runSamples(Configuration.builder().build());
    }

    @Test
    public void testSamplesWithoutDeterminization() {
        runSamples(Configuration.builder().withDeterminization(false).build());
    }

    @Test
    public void testSamplesMergedIntoOneMatcher() {
        // the union is too large to determinize within this limit, so it is matched nondeterministically
        ValueMatcher valueMatcher = new ValueMatcher(Configuration.builder().withMaxDfaStates(500).build());
        List<FieldMatcher> matchers = new ArrayList<>();
        for (JsonNode sample : samples) {
            FieldMatcher matcher = new FieldMatcher(sample.get("regexp").asText());
            matchers.add(matcher);
            valueMatcher.addPattern(Patterns.regexpMatch(matcher.getName()), matcher);
        }
        for (int i = 0; i < samples.size(); i++) {
            JsonNode sample = samples.get(i);
            FieldMatcher matcher = matchers.get(i);
            for (JsonNode value : sample.get("matches")) {
                assertTrue(matcher.getName() + " should match " + value.asText(),
                        valueMatcher.transitionOn(quoted(value.asText())).contains(matcher));
            }
            for (JsonNode value : sample.get("nonMatches")) {
                assertFalse(matcher.getName() + " should not match " + value.asText(),
                        valueMatcher.transitionOn(quoted(value.asText())).contains(matcher));
            }
        }
    }

    private static void runSamples(Configuration configuration) {
        for (JsonNode sample : samples) {
            String regexp = sample.get("regexp").asText();
            ValueMatcher valueMatcher = new ValueMatcher(configuration);
            FieldMatcher matcher = new FieldMatcher(regexp);
            valueMatcher.addPattern(Patterns.regexpMatch(regexp), matcher);
            for (JsonNode value : sample.get("matches")) {
                assertEquals(regexp + " should match " + value.asText(),
                        Collections.singleton(matcher), valueMatcher.transitionOn(quoted(value.asText())));
            }
            for (JsonNode value : sample.get("nonMatches")) {
                assertTrue(regexp + " should not match " + value.asText(),
                        valueMatcher.transitionOn(quoted(value.asText())).isEmpty());
            }
        }
    }
}
