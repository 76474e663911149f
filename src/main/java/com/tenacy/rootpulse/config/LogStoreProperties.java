package com.tenacy.rootpulse.config;

import com.tenacy.rootpulse.query.QueryScope;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rootpulse.logstore")
public class LogStoreProperties {

    @NotBlank
    private String uris = "http://localhost:9200";

    private String project = "";

    @NotBlank
    private String logstore = "logstore-tracing";

    private String region = "";

    @Min(1)
    private int socketTimeout = 30000;

    @Min(1)
    private int connectionTimeout = 5000;

    public QueryScope toQueryScope() {
        return new QueryScope(project, logstore, region);
    }
}
