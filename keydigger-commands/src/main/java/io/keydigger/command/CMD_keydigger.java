package io.keydigger.command;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.keydigger.command.keys.CMD_keys;
import io.keydigger.command.resolve.CMD_resolve;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Inspect key stores and resolve pattern specs into work units
@CommandLine.Command(name = "keydigger",
    header = "Inspect key stores and resolve pattern specs into work units",
    description = "Contains subcommands to list the keys of a store and to resolve pattern specs against it",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_keys.class,
        CMD_resolve.class,
        CommandLine.HelpCommand.class
    })
public class CMD_keydigger implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_keydigger.class);

    /// Create the CMD_keydigger command
    public CMD_keydigger() {}

    /// Run a keydigger command
    /// @param args Command line arguments
    public static void main(String[] args) {
        CMD_keydigger command = new CMD_keydigger();
        logger.debug("instancing commandline");
        CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        int exitCode = commandLine.execute(args);
        logger.debug("exiting main");
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }
}
