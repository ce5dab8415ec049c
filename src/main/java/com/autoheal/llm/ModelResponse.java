package com.autoheal.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of ModelClient.analyze(): either response text or an error message,
 * plus the name of the backend that produced it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ModelResponse {

    private final String response;
    private final String error;
    private final String backend;

    private ModelResponse(String response, String error, String backend) {
        this.response = response;
        this.error    = error;
        this.backend  = backend;
    }

    public static ModelResponse success(String response, String backend) {
        return new ModelResponse(response != null ? response : "", null, backend);
    }

    public static ModelResponse error(String error, String backend) {
        return new ModelResponse(null, error, backend);
    }

    @JsonProperty("response") public String getResponse() { return response; }
    @JsonProperty("error")    public String getError()    { return error; }
    @JsonProperty("backend")  public String getBackend()  { return backend; }

    public boolean isSuccess() {
        return error == null;
    }

    /** Success with non-blank text. */
    public boolean hasText() {
        return isSuccess() && !response.isBlank();
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ModelResponse{backend=" + backend + ", chars=" + response.length() + "}"
                : "ModelResponse{backend=" + backend + ", error=" + error + "}";
    }
}
