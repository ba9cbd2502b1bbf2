package io.leavesfly.vshell.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * 内置命令共享的外部服务
 */
@Getter
@Builder
public class CommandServices {

    @Builder.Default
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Builder.Default
    private final WebClient webClient = WebClient.create();

    @Builder.Default
    private final Clock clock = Clock.systemDefaultZone();

    public static CommandServices defaults() {
        return CommandServices.builder().build();
    }
}
