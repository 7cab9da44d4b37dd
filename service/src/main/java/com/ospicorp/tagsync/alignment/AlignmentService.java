package com.ospicorp.tagsync.alignment;

import com.ospicorp.tagsync.ingest.InstrumentSource;
import com.ospicorp.tagsync.ingest.SourceTable;
import com.ospicorp.tagsync.series.model.ResampleSpec;
import com.ospicorp.tagsync.series.model.SeriesColumn;
import com.ospicorp.tagsync.series.model.Table;
import com.ospicorp.tagsync.series.model.TimeSeries;
import com.ospicorp.tagsync.series.report.DiagnosticKind;
import com.ospicorp.tagsync.series.report.ProcessingReport;
import com.ospicorp.tagsync.series.service.Aligner;
import com.ospicorp.tagsync.series.service.FlexibleDateTimeParser;
import com.ospicorp.tagsync.series.service.FrequencyInferencer;
import com.ospicorp.tagsync.series.service.ResamplePeriods;
import com.ospicorp.tagsync.series.service.Resampler;
import com.ospicorp.tagsync.series.service.SeriesBuilder;
import com.ospicorp.tagsync.series.service.SeriesDefinition;
import com.ospicorp.tagsync.series.service.WindowBounds;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs the whole pipeline for one source file: split into instruments, build each series, infer
 * its period, resample when asked, and align everything onto one grid.
 */
@Service
public class AlignmentService {
  private static final Logger log = LoggerFactory.getLogger(AlignmentService.class);
  private static final Duration DEFAULT_GRID_PERIOD = Duration.ofSeconds(1);

  private final FlexibleDateTimeParser parser;
  private final Clock clock;
  private final String defaultTimeFormat;
  private final long maxResamplePoints;
  private final long maxAlignRows;
  private final boolean parallel;

  public AlignmentService(FlexibleDateTimeParser parser, Clock clock,
      @Value("${tagsync.source.time-format:" + SeriesBuilder.DEFAULT_TIME_FORMAT + "}")
      String defaultTimeFormat,
      @Value("${tagsync.resample.max-points:10000000}") long maxResamplePoints,
      @Value("${tagsync.align.max-rows:10000000}") long maxAlignRows,
      @Value("${tagsync.pipeline.parallel:false}") boolean parallel) {
    this.parser = parser;
    this.clock = clock;
    this.defaultTimeFormat = defaultTimeFormat;
    this.maxResamplePoints = maxResamplePoints;
    this.maxAlignRows = maxAlignRows;
    this.parallel = parallel;
  }

  public AlignmentResult align(SourceTable source, AlignmentRequest request) {
    List<InstrumentSource> instruments = request.layout().split(source);
    log.info("Source split into {} instrument(s) using layout {}", instruments.size(),
        request.layout());
    return align(instruments, request);
  }

  public AlignmentResult align(List<InstrumentSource> instruments, AlignmentRequest request) {
    long started = System.currentTimeMillis();
    ProcessingReport report = new ProcessingReport();
    WindowBounds window = WindowBounds.resolve(request.start(), request.end(), parser,
        LocalDate.now(clock), report);
    ResampleSpec spec = resampleSpec(request, report);
    SeriesBuilder builder = new SeriesBuilder(timeFormatFor(request), parser);

    Stream<InstrumentSource> stream = parallel
        ? instruments.parallelStream()
        : instruments.stream();
    List<Processed> processed = stream
        .map(instrument -> process(instrument, request, window, spec, builder))
        .sorted(Comparator.comparing((Processed p) -> p.series().name()))
        .toList();

    List<TimeSeries> series = new ArrayList<>(processed.size());
    List<SeriesSummary> summaries = new ArrayList<>(processed.size());
    for (Processed p : processed) {
      report.merge(p.report());
      series.add(p.series());
      summaries.add(p.summary());
    }

    Duration gridPeriod = spec != null ? spec.targetPeriod() : DEFAULT_GRID_PERIOD;
    Table table = Aligner.align(series, window, gridPeriod, maxAlignRows);
    log.info("Alignment finished: {} series, {} rows, {} warning(s) in {} ms", series.size(),
        table.rowCount(), report.warningCount(), System.currentTimeMillis() - started);
    return new AlignmentResult(table, gridPeriod, summaries, report.diagnostics());
  }

  private Processed process(InstrumentSource instrument, AlignmentRequest request,
      WindowBounds window, ResampleSpec spec, SeriesBuilder builder) {
    ProcessingReport report = new ProcessingReport();
    TimeSeries series = builder.build(new SeriesDefinition(instrument.name(),
        instrument.timestampLabel(), instrument.valueLabel(), instrument.records(),
        request.valueFilter(), window), report);
    Duration nativePeriod = FrequencyInferencer.infer(series, report);
    int samples = series.size();
    LocalDateTime first = series.first();
    LocalDateTime last = series.last();
    if (spec != null) {
      Resampler.resample(series, spec, report, maxResamplePoints);
    }
    List<String> columns = series.columns().stream().map(SeriesColumn::label).toList();
    SeriesSummary summary = new SeriesSummary(series.name(), samples,
        ResamplePeriods.format(nativePeriod), first, last, columns);
    return new Processed(series, summary, report);
  }

  private ResampleSpec resampleSpec(AlignmentRequest request, ProcessingReport report) {
    if (!StringUtils.hasText(request.resample())) {
      if (StringUtils.hasText(request.stats())) {
        report.warn(DiagnosticKind.STATS_IGNORED, null,
            "Statistics '" + request.stats() + "' ignored because no resample period was given");
      }
      return null;
    }
    Duration target;
    try {
      target = ResamplePeriods.parse(request.resample());
    } catch (IllegalArgumentException ex) {
      report.warn(DiagnosticKind.PERIOD_DEFAULTED, null,
          ex.getMessage() + "; resampling to " + ResamplePeriods.format(DEFAULT_GRID_PERIOD));
      target = DEFAULT_GRID_PERIOD;
    }
    return ResampleSpec.of(target, request.stats());
  }

  String timeFormatFor(AlignmentRequest request) {
    if (StringUtils.hasText(request.timeFormat())) {
      return request.timeFormat();
    }
    String layoutFormat = request.layout().defaultTimeFormat();
    return layoutFormat != null ? layoutFormat : defaultTimeFormat;
  }

  private record Processed(TimeSeries series, SeriesSummary summary, ProcessingReport report) {}
}
