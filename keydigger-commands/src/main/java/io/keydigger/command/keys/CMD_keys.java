package io.keydigger.command.keys;

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

import io.keydigger.api.keys.KeyPaths;
import io.keydigger.command.common.StoreOption;
import io.keydigger.core.store.CachingKeyStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// List the keys or groups of a key store
///
/// Filters combine: `--group` keeps keys directly under a group, `--find` keeps keys containing
/// every fragment, and `--match` keeps keys matched by a regular expression from their start.
@CommandLine.Command(name = "keys",
    header = "List the keys or groups of a key store",
    description = "Lists the visible keys of a directory, archive or HDF5 file, one per line")
public class CMD_keys implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_keys.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 1;

    @CommandLine.Mixin
    private StoreOption storeOption = new StoreOption();

    @CommandLine.Option(names = {"--groups"}, description = "List groups instead of keys")
    private boolean groups;

    @CommandLine.Option(names = {"-g", "--group"}, description = "Only keys directly under this group")
    private String group;

    @CommandLine.Option(names = {"-f", "--find"}, description = "Only keys containing this fragment (repeatable)")
    private List<String> fragments = new ArrayList<>();

    @CommandLine.Option(names = {"-m", "--match"}, description = "Only keys matching this regular expression")
    private String match;

    @CommandLine.Option(names = {"-d", "--describe"}, description = "Print the store description first, if it has one")
    private boolean describe;

    @Override
    public Integer call() {
        try {
            CachingKeyStore store = storeOption.open();
            if (describe) {
                store.description().ifPresent(System.out::println);
            }
            if (groups) {
                store.groups().forEach(System.out::println);
                return EXIT_SUCCESS;
            }
            List<String> selected = new ArrayList<>(store.find(fragments.toArray(new String[0])));
            if (match != null) {
                List<String> matched = store.refind(match);
                selected.retainAll(matched);
            }
            for (String key : selected) {
                if (group == null || KeyPaths.isDirectChild(key, group)) {
                    System.out.println(key);
                }
            }
            logger.debug("Listed {} of {} keys from {}", selected.size(), store.keys().size(), store.location());
            return EXIT_SUCCESS;
        } catch (Exception e) {
            logger.error("Failed to list keys of {}", storeOption.getStorePath(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
