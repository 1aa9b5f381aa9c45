package me.golemcore.deploy.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialsRequest {
    private String principal;
    @JsonAlias("session_id")
    private String sessionId;
    @JsonAlias("access_key_id")
    private String accessKeyId;
    @ToString.Exclude
    @JsonAlias("secret_access_key")
    private String secretAccessKey;
    @ToString.Exclude
    @JsonAlias("session_token")
    private String sessionToken;
    private String region;
}
