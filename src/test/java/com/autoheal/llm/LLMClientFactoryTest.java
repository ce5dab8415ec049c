package com.autoheal.llm;

import com.autoheal.config.AutoHealProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LLMClientFactoryTest {

    private final Map<String, String> env = new HashMap<>();

    private ModelClient create(AutoHealProperties.Model settings) {
        return new LLMClientFactory(settings, WebClient.builder(), new RestTemplate(), new ObjectMapper(), env::get)
                .create();
    }

    private AutoHealProperties.Model settings(String backend) {
        AutoHealProperties.Model settings = new AutoHealProperties().getModel();
        settings.setBackend(backend);
        return settings;
    }

    @Test
    void testDisabledByConfiguration() {
        ModelClient client = create(settings("disabled"));

        assertEquals(BackendProfile.Kind.DISABLED, client.getProfile().getKind());
        assertFalse(client.getProfile().isSubstituted());
        assertFalse(client.isAvailable());
    }

    @Test
    void testGeminiWithCredentialFromEnvironment() {
        env.put(LLMClientFactory.GEMINI_KEY_ENV, "gemini-key");

        ModelClient client = create(settings("gemini"));

        BackendProfile profile = client.getProfile();
        assertEquals(BackendProfile.Kind.PRIMARY, profile.getKind());
        assertEquals("gemini", profile.getBackendName());
        assertTrue(profile.isCredentialConfigured());
        assertTrue(client.isAvailable());
    }

    @Test
    void testExplicitCredentialWinsOverEnvironment() {
        env.put(LLMClientFactory.GEMINI_KEY_ENV, "from-env");
        AutoHealProperties.Model settings = settings("gemini");
        settings.getGemini().setApiKey("from-config");

        assertEquals("from-config", create(settings).getProfile().getCredential());
    }

    @Test
    void testGeminiWithoutKeySubstitutesOpenAi() {
        env.put(LLMClientFactory.OPENAI_KEY_ENV, "openai-key");

        BackendProfile profile = create(settings("gemini")).getProfile();

        assertEquals(BackendProfile.Kind.OPENAI_COMPATIBLE, profile.getKind());
        assertEquals("openai", profile.getBackendName());
        assertTrue(profile.isSubstituted());
        assertTrue(profile.getSubstitutionReason().startsWith("gemini unavailable"));
    }

    @Test
    void testNoCredentialsAnywhereDisablesClient() {
        ModelClient client = create(settings("gemini"));

        assertEquals(BackendProfile.Kind.DISABLED, client.getProfile().getKind());
        assertTrue(client.getProfile().isSubstituted());
        assertFalse(client.analyze("Analyze").isSuccess());
    }

    @Test
    void testOllamaNeedsNoCredential() {
        BackendProfile profile = create(settings("ollama")).getProfile();

        assertEquals(BackendProfile.Kind.OPENAI_COMPATIBLE, profile.getKind());
        assertEquals("ollama", profile.getBackendName());
        assertEquals(LLMClientFactory.LOCAL_BASE_URL, profile.getEndpoint());
        assertEquals("llama2", profile.getModel());
        assertFalse(profile.isCredentialConfigured());
    }

    @Test
    void testLocalBaseUrlFromEnvironmentSwitchesToLocalMode() {
        env.put(LLMClientFactory.OPENAI_URL_ENV, "http://localhost:11434");

        BackendProfile profile = create(settings("openai")).getProfile();

        assertEquals("ollama", profile.getBackendName());
        assertEquals("http://localhost:11434/v1", profile.getEndpoint());
    }

    @Test
    void testUnknownBackendFallsBack() {
        env.put(LLMClientFactory.OPENAI_KEY_ENV, "openai-key");

        BackendProfile profile = create(settings("mystery-backend")).getProfile();

        assertEquals(BackendProfile.Kind.OPENAI_COMPATIBLE, profile.getKind());
        assertTrue(profile.isSubstituted());
        assertTrue(profile.getSubstitutionReason().contains("mystery-backend"));
    }

    @Test
    void testLocalEndpointDetection() {
        assertTrue(LLMClientFactory.isLocalEndpoint("http://127.0.0.1:11434/v1"));
        assertTrue(LLMClientFactory.isLocalEndpoint("http://my-ollama-box:8080"));
        assertFalse(LLMClientFactory.isLocalEndpoint("https://api.openai.com/v1"));
        assertFalse(LLMClientFactory.isLocalEndpoint(null));
    }

    @Test
    void testNormalizeLocalUrl() {
        assertEquals("http://localhost:11434/v1", LLMClientFactory.normalizeLocalUrl("http://localhost:11434/"));
        assertEquals("http://localhost:11434/v1", LLMClientFactory.normalizeLocalUrl("http://localhost:11434/v1"));
        assertEquals(LLMClientFactory.LOCAL_BASE_URL, LLMClientFactory.normalizeLocalUrl("ollama"));
    }
}
