package io.remint.coin;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.remint.coin.config.CategoryCatalog;
import io.remint.coin.config.CategoryConfigLoader;
import io.remint.coin.output.CsvRowSink;
import io.remint.coin.output.RowSink;
import io.remint.coin.output.WorkbookRowSink;
import io.remint.coin.table.TableAssembler;
import io.remint.coin.table.TimeFilter;
import io.remint.core.Source;
import io.remint.metrics.Metrics;
import io.remint.runtime.Pipeline;
import io.remint.runtime.PipelineBuilder;
import io.remint.source.LogFileSource;

import java.io.IOException;

public class RemintModule extends AbstractModule {
    private final RunConfig config;

    public RemintModule(RunConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(RunConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton CategoryCatalog catalog() throws IOException {
        return config.configFile() == null ? CategoryConfigLoader.loadDefault() : CategoryConfigLoader.load(config.configFile());
    }

    @Provides @Singleton RowSink rowSink() throws IOException {
        return config.format().isWorkbook() ? new WorkbookRowSink(config.workbookFile()) : new CsvRowSink(config.outputPrefix());
    }

    @Provides Source<String> source() { return new LogFileSource(config.inputs(), config.charset()); }

    @Provides @Singleton TableAssembler assembler(CategoryCatalog catalog, RowSink sink, MetricRegistry registry) {
        return new TableAssembler(catalog, sink, new TimeFilter(config.window(), config.zone()),
                config.categoryFilter(), new Metrics(registry));
    }

    @Provides @Singleton Pipeline<String> pipeline(Source<String> src, TableAssembler assembler, MetricRegistry registry) {
        return new PipelineBuilder<String>()
                .source(src)
                .sink(assembler)
                .metrics(registry)
                .build();
    }
}
