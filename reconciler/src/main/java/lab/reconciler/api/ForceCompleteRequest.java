package lab.reconciler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ForceCompleteRequest(
        @JsonProperty("operator") String operator,
        @JsonProperty("totp_code") String totpCode
) {}
