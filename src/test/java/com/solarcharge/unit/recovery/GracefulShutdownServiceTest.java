package com.solarcharge.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import com.solarcharge.recovery.GracefulShutdownService;
import com.solarcharge.session.ChargingCoordinator;
import com.solarcharge.session.CoordinatorWorker;
import com.solarcharge.transport.ControlCommandSender;
import com.solarcharge.transport.MqttTelemetrySubscriber;
import java.util.concurrent.Callable;
import javax.sql.DataSource;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

/**
 * Verifies the shutdown order: intake stops, timers are cancelled on the worker, the worker
 * drains, queued control publishes finish, then the store pool and the MQTT client are closed.
 */
@ExtendWith(MockitoExtension.class)
class GracefulShutdownServiceTest {

    @Mock
    private ChargingCoordinator chargingCoordinator;

    @Mock
    private CoordinatorWorker coordinatorWorker;

    @Mock
    private ControlCommandSender controlCommandSender;

    @Mock
    private MqttTelemetrySubscriber mqttTelemetrySubscriber;

    @Mock
    private IMqttAsyncClient mqttClient;

    @Mock
    private IMqttToken disconnectToken;

    private DataSource dataSource;
    private GracefulShutdownService shutdownService;

    @BeforeEach
    void setUp() {
        dataSource = mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("mqttTelemetrySubscriber", mqttTelemetrySubscriber);
        beans.addBean("mqttClient", mqttClient);
        beans.addBean("dataSource", dataSource);

        ObjectProvider<MqttTelemetrySubscriber> subscriberProvider = beans.getBeanProvider(MqttTelemetrySubscriber.class);
        ObjectProvider<IMqttAsyncClient> clientProvider = beans.getBeanProvider(IMqttAsyncClient.class);
        ObjectProvider<DataSource> dataSourceProvider = beans.getBeanProvider(DataSource.class);

        shutdownService = new GracefulShutdownService(
                chargingCoordinator,
                coordinatorWorker,
                controlCommandSender,
                subscriberProvider,
                clientProvider,
                dataSourceProvider);
    }

    @Test
    @DisplayName("stop runs the shutdown sequence in order")
    void shutdownOrder() throws Exception {
        when(coordinatorWorker.call(any())).thenAnswer(inv -> inv.<Callable<?>>getArgument(0).call());
        when(mqttClient.isConnected()).thenReturn(true);
        when(mqttClient.disconnect(anyLong())).thenReturn(disconnectToken);

        shutdownService.start();
        assertThat(shutdownService.isRunning()).isTrue();

        shutdownService.stop();

        InOrder order = inOrder(
                mqttTelemetrySubscriber, chargingCoordinator, coordinatorWorker, controlCommandSender, dataSource, mqttClient);
        order.verify(mqttTelemetrySubscriber).stopIntake();
        order.verify(chargingCoordinator).shutdown();
        order.verify(coordinatorWorker).drain();
        order.verify(controlCommandSender).shutdown();
        order.verify((AutoCloseable) dataSource).close();
        order.verify(mqttClient).disconnect(anyLong());
        order.verify(mqttClient).close();
        assertThat(shutdownService.isRunning()).isFalse();
    }

    @Test
    @DisplayName("runs before other lifecycle beans stop")
    void highPhase() {
        assertThat(shutdownService.getPhase()).isEqualTo(Integer.MAX_VALUE - 1);
        assertThat(shutdownService.isAutoStartup()).isTrue();
    }
}
