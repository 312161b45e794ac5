package me.golemcore.guard;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the command and file validation engine.
 *
 * <p>
 * The engine gates shell commands and file operations proposed by an AI
 * coding agent. Commands are normalized (percent, hex and octal escapes,
 * quote splitting, line continuations, invisible characters and homoglyphs)
 * before they are matched against deny and warn registries; file paths are
 * matched against blocked file names and path fragments.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → GuardCommandLineRunner, SecurityCommandRouter
 * Engine             → ToolCallGuard, CommandValidator, FileValidator
 * Infrastructure     → GuardProperties, SecurityEngineConfiguration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code guard.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardApplication.class, args);
    }

}
