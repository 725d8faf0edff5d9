package io.paxbridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class PaxToolTest {
    private static final String ADDRESS = "RAqS1bAuWqW2f6ufsU5H4XpKfy5Pqj2oHz";
    private static final String PUBKEY = "025553440065cd1d000000003c1111111111111111111111111111111111111111";

    private final ObjectMapper mapper = new ObjectMapper();
    private ByteArrayOutputStream byteArrayOutputStream;
    private PrintStream console;

    @Before
    public void setup() {
        byteArrayOutputStream = new ByteArrayOutputStream();
        console = System.out;
    }

    private String runTest(final String[] args) {
        try {
            System.setOut(new PrintStream(byteArrayOutputStream));
            PaxTool.main(args);
            return byteArrayOutputStream.toString();
        } catch (Exception e) {
            fail("Unexpected error in tests: " + e.getMessage());
        } finally {
            System.setOut(console);
            byteArrayOutputStream.reset();
        }
        return null;
    }

    private JsonNode runJson(String command, String args) throws Exception {
        String result = runTest(new String[]{command, args});
        assertNotNull(result);
        return mapper.readTree(result.trim());
    }

    @Test
    public void testUsage() {
        String result = runTest(new String[]{"help"});
        assertTrue(result != null && result.contains("Usage") && result.contains("Supported commands"));
        assertTrue(result.contains("decodeOpReturn"));
    }

    @Test
    public void testUnsupportedCommand() {
        String result = runTest(new String[]{"mint"});
        assertTrue(result != null && result.contains("unsupported command 'mint'"));
    }

    @Test
    public void testInvalidJson() {
        String result = runTest(new String[]{"decodePaxPubkey", "{notjson"});
        assertTrue(result != null && result.contains("Json expected"));
    }

    @Test
    public void testEncodePaxPubkey() throws Exception {
        JsonNode result = runJson("encodePaxPubkey",
                "{\"ticker\":\"usd\",\"amount\":500000000,\"address\":\"" + ADDRESS + "\"}");
        assertEquals(PUBKEY, result.get("pubkey").asText());
    }

    @Test
    public void testEncodePaxPubkey_missingArgument() throws Exception {
        JsonNode result = runJson("encodePaxPubkey", "{\"ticker\":\"USD\",\"address\":\"" + ADDRESS + "\"}");
        assertEquals("amount is not specified or has invalid format.", result.get("error").asText());
        assertTrue(result.has("Usage"));
    }

    @Test
    public void testEncodePaxPubkey_badAddress() throws Exception {
        JsonNode result = runJson("encodePaxPubkey", "{\"ticker\":\"USD\",\"amount\":1,\"address\":\"nope\"}");
        assertTrue(result.get("error").asText().startsWith("Invalid address"));
    }

    @Test
    public void testDecodePaxPubkey() throws Exception {
        JsonNode result = runJson("decodePaxPubkey", "{\"pubkey\":\"" + PUBKEY + "\"}");
        assertFalse(result.get("short").asBoolean());
        assertEquals("USD", result.get("ticker").asText());
        assertEquals(500000000L, result.get("amount").asLong());
        assertEquals(60, result.get("addressType").asInt());
        assertEquals(ADDRESS, result.get("address").asText());
    }

    @Test
    public void testDecodeOpReturn() throws Exception {
        JsonNode result = runJson("decodeOpReturn", "{\"script\":\"6a2657" + PUBKEY + "e8030000\"}");
        assertEquals("W", result.get("tag").asText());
        assertEquals(38, result.get("payloadLength").asInt());
        assertEquals(1000, result.get("height").asInt());
        assertEquals(500000000L, result.get("withdrawal").get("amount").asLong());
    }

    @Test
    public void testDecodeOpReturn_notOpReturn() throws Exception {
        JsonNode result = runJson("decodeOpReturn", "{\"script\":\"76a914\"}");
        assertEquals("script is not an OP_RETURN output.", result.get("error").asText());

        result = runJson("decodeOpReturn", "{\"script\":\"6a4c\"}");
        assertTrue(result.has("error"));
    }

    @Test
    public void testArgumentsFromFile() throws Exception {
        Path file = Files.createTempFile("paxtool", ".json");
        try {
            Files.write(file, ("{\"pubkey\":\"" + PUBKEY + "\"}").getBytes(StandardCharsets.UTF_8));
            JsonNode result = runJson("decodePaxPubkey", "-f " + file.toAbsolutePath());
            assertEquals(ADDRESS, result.get("address").asText());
        } finally {
            Files.deleteIfExists(file);
        }

        String missing = runTest(new String[]{"decodePaxPubkey", "-f /nonexistent/paxtool.json"});
        assertTrue(missing != null && missing.contains("not found"));
    }
}
