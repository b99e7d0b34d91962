package com.chicu.aifinetune.ai.ml;

import com.chicu.aifinetune.ai.ml.sidecar.props.MlSidecarProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MlSidecarProperties.class)
public class MlConfig {
}
