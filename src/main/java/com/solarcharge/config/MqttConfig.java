package com.solarcharge.config;

import java.util.UUID;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Paho MQTT client wiring. Disabled with {@code solarcharge.mqtt.enabled=false}.
 *
 * <p>The client bean has no destroy method: {@link com.solarcharge.recovery.GracefulShutdownService}
 * disconnects and closes it after the store pool is released.
 */
@Configuration
@ConditionalOnProperty(name = "solarcharge.mqtt.enabled", havingValue = "true", matchIfMissing = true)
public class MqttConfig {

    @Value("${solarcharge.mqtt.broker-url:tcp://localhost:1883}")
    private String brokerUrl;

    @Value("${solarcharge.mqtt.client-id-prefix:solar-charge-backend-}")
    private String clientIdPrefix;

    @Value("${solarcharge.mqtt.username:}")
    private String username;

    @Value("${solarcharge.mqtt.password:}")
    private String password;

    @Bean(destroyMethod = "")
    public IMqttAsyncClient mqttClient() throws MqttException {
        String clientId = clientIdPrefix + UUID.randomUUID().toString().substring(0, 8);
        return new MqttAsyncClient(brokerUrl, clientId, new MemoryPersistence());
    }

    @Bean
    public MqttConnectOptions mqttConnectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        options.setKeepAliveInterval(60);
        options.setConnectionTimeout(30);
        if (!username.isBlank()) {
            options.setUserName(username);
            options.setPassword(password.toCharArray());
        }
        return options;
    }
}
