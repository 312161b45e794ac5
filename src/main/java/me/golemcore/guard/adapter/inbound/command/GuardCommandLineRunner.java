package me.golemcore.guard.adapter.inbound.command;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.guard.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives {@link CommandPort} from program arguments.
 *
 * <p>
 * Usage: {@code [--json] <command> [args...]}. Options are only recognized
 * before the command name, so {@code check rm --force x} validates the whole
 * tail. With {@code --json} the structured payload is printed as JSON instead
 * of the human-readable text. Without arguments the runner does nothing.
 */
@Component
@Slf4j
public class GuardCommandLineRunner implements CommandLineRunner {

    private static final String JSON_FLAG = "--json";
    private static final String OPTION_PREFIX = "--";

    private final CommandPort commandPort;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public GuardCommandLineRunner(CommandPort commandPort, ObjectMapper objectMapper) {
        this(commandPort, objectMapper, System.out);
    }

    GuardCommandLineRunner(CommandPort commandPort, ObjectMapper objectMapper, PrintStream out) {
        this.commandPort = commandPort;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(String... args) throws Exception {
        boolean json = false;
        int index = 0;
        while (index < args.length && args[index].startsWith(OPTION_PREFIX)) {
            if (JSON_FLAG.equals(args[index])) {
                json = true;
            }
            index++;
        }
        if (index >= args.length) {
            return;
        }

        String command = args[index];
        List<String> commandArgs = Arrays.asList(args).subList(index + 1, args.length);
        CommandPort.CommandResult result = commandPort.execute(command, commandArgs, Map.of()).get();
        if (!result.success()) {
            log.warn("Command '{}' failed", command);
        }

        if (json) {
            Object payload = result.data();
            if (payload == null) {
                Map<String, Object> plain = new LinkedHashMap<>();
                plain.put("success", result.success());
                plain.put("output", result.output());
                payload = plain;
            }
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload));
        } else {
            out.println(result.output());
        }
    }
}
