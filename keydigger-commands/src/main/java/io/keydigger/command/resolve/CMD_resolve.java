package io.keydigger.command.resolve;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.keydigger.command.common.StoreOption;
import io.keydigger.core.catalog.SpecCatalog;
import io.keydigger.core.pattern.PatternSpec;
import io.keydigger.core.resolve.Resolver;
import io.keydigger.core.resolve.WorkUnit;
import io.keydigger.core.store.CachingKeyStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Resolve the pattern specs of a catalog against a key store and print the work units
@CommandLine.Command(name = "resolve",
    header = "Resolve pattern specs against a key store",
    description = "Prints the work units each pattern spec of a catalog resolves to")
public class CMD_resolve implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_resolve.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 1;

    /// Output formats
    public enum Format {
        text,
        json
    }

    @CommandLine.Mixin
    private StoreOption storeOption = new StoreOption();

    @CommandLine.Option(names = {"-c", "--catalog"}, required = true,
        description = "A YAML file with a 'specs' map of named pattern specs")
    private Path catalogPath;

    @CommandLine.Option(names = {"-s", "--spec"},
        description = "Only resolve the named spec (repeatable; default: all specs)")
    private List<String> specNames = new ArrayList<>();

    @CommandLine.Option(names = {"--format"}, defaultValue = "text",
        description = "Output format, one of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format = Format.text;

    @Override
    public Integer call() {
        try {
            SpecCatalog catalog = SpecCatalog.load(catalogPath);
            List<PatternSpec> specs = selectSpecs(catalog);
            CachingKeyStore store = storeOption.open();

            Map<String, List<WorkUnit>> resolved = new LinkedHashMap<>();
            for (PatternSpec spec : specs) {
                resolved.put(spec.name(), Resolver.resolve(store, spec));
            }
            if (format == Format.json) {
                System.out.println(gson.toJson(toJsonTree(resolved)));
            } else {
                printText(resolved);
            }
            return EXIT_SUCCESS;
        } catch (Exception e) {
            logger.error("Failed to resolve {} against {}", catalogPath, storeOption.getStorePath(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private List<PatternSpec> selectSpecs(SpecCatalog catalog) {
        if (specNames.isEmpty()) {
            return catalog.specs();
        }
        List<PatternSpec> selected = new ArrayList<>();
        for (String name : specNames) {
            selected.add(catalog.get(name).orElseThrow(() -> new IllegalArgumentException(
                "No spec named '" + name + "' in " + catalogPath + ", available: " + catalog.names())));
        }
        return selected;
    }

    private void printText(Map<String, List<WorkUnit>> resolved) {
        for (Map.Entry<String, List<WorkUnit>> entry : resolved.entrySet()) {
            System.out.println(entry.getKey() + " (" + entry.getValue().size() + " work units)");
            for (WorkUnit unit : entry.getValue()) {
                System.out.println("  " + unit.label() + "\tgroup=" + unit.group()
                    + "\tprimary=" + unit.primaryKeys()
                    + (unit.auxiliaryKeys().isEmpty() ? "" : "\tauxiliary=" + unit.auxiliaryKeys()));
            }
        }
    }

    private static Map<String, Object> toJsonTree(Map<String, List<WorkUnit>> resolved) {
        Map<String, Object> tree = new LinkedHashMap<>();
        resolved.forEach((name, units) -> {
            List<Map<String, Object>> entries = new ArrayList<>();
            for (WorkUnit unit : units) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("group", unit.group());
                entry.put("label", unit.label());
                entry.put("primaryKeys", unit.primaryKeys());
                entry.put("auxiliaryKeys", unit.auxiliaryKeys());
                entries.add(entry);
            }
            tree.put(name, entries);
        });
        return tree;
    }
}
