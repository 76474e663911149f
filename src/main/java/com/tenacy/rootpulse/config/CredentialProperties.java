package com.tenacy.rootpulse.config;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rootpulse.credentials")
public class CredentialProperties {

    /** false 이면 키가 비어 있을 때 인증 헤더 없이 접근한다 (로컬/테스트용) */
    private boolean required = true;

    private String accessKeyId = "";

    private String accessKeySecret = "";

    private String securityToken = "";

    /** 발급된 자격 증명의 유효 기간 */
    @NotNull
    private Duration ttl = Duration.ofHours(1);

    /** 만료 전 이 시간만큼 앞당겨 갱신 */
    @NotNull
    private Duration refreshSkew = Duration.ofMinutes(5);
}
