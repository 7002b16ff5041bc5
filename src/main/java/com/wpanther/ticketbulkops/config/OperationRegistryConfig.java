package com.wpanther.ticketbulkops.config;

import com.wpanther.ticketbulkops.operation.OperationRegistry;
import com.wpanther.ticketbulkops.operation.impl.ApplyMacroToViewOperation;
import com.wpanther.ticketbulkops.operation.impl.MacroSearchOperation;
import com.wpanther.ticketbulkops.operation.impl.TagManagerOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the built-in operations. The list below is the complete catalog, in display order.
 * A duplicate slug fails context startup.
 */
@Configuration
@Slf4j
public class OperationRegistryConfig {

    @Bean
    public OperationRegistry operationRegistry(TagManagerOperation tagManager,
                                               ApplyMacroToViewOperation applyMacroToView,
                                               MacroSearchOperation macroSearch) {
        OperationRegistry registry = new OperationRegistry();
        registry.register(macroSearch);
        registry.register(tagManager);
        registry.register(applyMacroToView);
        log.info("Registered {} operations: {}", registry.all().size(), registry.all().keySet());
        return registry;
    }
}
