package com.autoheal.llm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which backend is active and how it is reached. Built once by LLMClientFactory;
 * immutable for the lifetime of the process.
 *
 * The credential is held but never serialized.
 */
public final class BackendProfile {

    public enum Kind {
        PRIMARY,
        OPENAI_COMPATIBLE,
        DISABLED
    }

    private final Kind    kind;
    private final String  backendName;
    private final String  endpoint;
    private final String  model;
    private final String  credential;
    private final boolean substituted;
    private final String  substitutionReason;

    public BackendProfile(Kind kind,
                          String backendName,
                          String endpoint,
                          String model,
                          String credential,
                          boolean substituted,
                          String substitutionReason) {
        this.kind               = kind;
        this.backendName        = backendName;
        this.endpoint           = endpoint;
        this.model              = model;
        this.credential         = credential;
        this.substituted        = substituted;
        this.substitutionReason = substitutionReason;
    }

    public static BackendProfile disabled(String reason, boolean substituted) {
        return new BackendProfile(Kind.DISABLED, "disabled", null, null, null, substituted, reason);
    }

    public BackendProfile asSubstitute(String reason) {
        return new BackendProfile(kind, backendName, endpoint, model, credential, true, reason);
    }

    @JsonProperty("kind")                public Kind    getKind()               { return kind; }
    @JsonProperty("backend")             public String  getBackendName()        { return backendName; }
    @JsonProperty("endpoint")            public String  getEndpoint()           { return endpoint; }
    @JsonProperty("model")               public String  getModel()              { return model; }
    @JsonIgnore                          public String  getCredential()         { return credential; }
    @JsonProperty("substituted")         public boolean isSubstituted()         { return substituted; }
    @JsonProperty("substitution_reason") public String  getSubstitutionReason() { return substitutionReason; }

    @JsonProperty("credential_configured")
    public boolean isCredentialConfigured() {
        return credential != null && !credential.isBlank();
    }

    @Override
    public String toString() {
        return String.format("BackendProfile{kind=%s, backend=%s, endpoint=%s, model=%s, substituted=%s}",
                kind, backendName, endpoint, model, substituted);
    }
}
