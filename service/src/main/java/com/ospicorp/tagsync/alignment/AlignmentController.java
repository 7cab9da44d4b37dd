package com.ospicorp.tagsync.alignment;

import com.ospicorp.tagsync.ingest.SourceLayout;
import com.ospicorp.tagsync.ingest.SourceTable;
import com.ospicorp.tagsync.ingest.SourceTableReader;
import com.ospicorp.tagsync.series.model.Stat;
import com.ospicorp.tagsync.series.service.StrftimeFormat;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1/alignments")
@Validated
@Tag(name = "Alignments")
public class AlignmentController {
  static final String ERROR_DOCS_BASE = "https://docs.tagsync.dev/errors/";
  static final String EXPORT_SUFFIX = "_ForExport.csv";
  private static final String STATS_REGEX = "^[A-Za-z]{0,16}$";

  private final AlignmentService service;
  private final SourceTableReader reader;
  private final String defaultEncoding;
  private final String defaultDelimiter;

  public AlignmentController(AlignmentService service, SourceTableReader reader,
      @Value("${tagsync.source.encoding:UTF-8}") String defaultEncoding,
      @Value("${tagsync.source.delimiter:,}") String defaultDelimiter) {
    this.service = service;
    this.reader = reader;
    this.defaultEncoding = defaultEncoding;
    this.defaultDelimiter = defaultDelimiter;
  }

  /** A statistic and the flag characters that select it. */
  public record StatFlag(String stat, String flags, String column) {}

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(summary = "Align an export file",
      description = "Parse an instrument export, resample every instrument and merge them onto "
          + "one timestamp grid.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Aligned table",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = AlignmentResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Nothing to align",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<?> align(
      @RequestParam("file") @Parameter(description = "Export file") MultipartFile file,
      @RequestParam(defaultValue = "trend")
          @Parameter(description = "Source layout: trend, archive or normalized") String layout,
      @RequestParam(required = false)
          @Parameter(description = "Target period, e.g. 5S or 1T", example = "1T") String resample,
      @RequestParam(required = false) @Pattern(regexp = STATS_REGEX)
          @Parameter(description = "Statistic flags: v, i, x, m/a, s/d", example = "ixm")
          String stats,
      @RequestParam(name = "value_filter", required = false)
          @Parameter(description = "Keep rows matching, e.g. val >= 0 and val <= 100")
          String valueFilter,
      @RequestParam(required = false) @Parameter(description = "Window start") String start,
      @RequestParam(required = false) @Parameter(description = "Window end") String end,
      @RequestParam(name = "time_format", required = false)
          @Parameter(description = "strftime-style timestamp format",
              example = "%m/%d/%Y %I:%M:%S %p") String timeFormat,
      @RequestParam(required = false) @Parameter(description = "Field delimiter") String delimiter,
      @RequestParam(required = false) @Parameter(description = "Source encoding") String encoding,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept)
      throws IOException {

    if (file.isEmpty()) {
      throw invalidParameter("file", "Uploaded file is empty.", 2001);
    }
    SourceLayout sourceLayout = parseLayout(layout);
    char separator = parseDelimiter(StringUtils.hasText(delimiter) ? delimiter : defaultDelimiter);
    Charset charset = parseEncoding(StringUtils.hasText(encoding) ? encoding : defaultEncoding);
    validateTimeFormat(timeFormat);
    MediaType contentType = selectMediaType(format, accept);

    SourceTable source;
    try (InputStream in = file.getInputStream()) {
      source = reader.read(in, charset, separator);
    }
    AlignmentResult result = service.align(source, new AlignmentRequest(sourceLayout, resample,
        stats, valueFilter, start, end, timeFormat));

    if (contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
      ContentDisposition disposition = ContentDisposition.attachment()
          .filename(exportName(file.getOriginalFilename()))
          .build();
      return ResponseEntity.ok()
          .contentType(contentType)
          .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
          .body(result.table());
    }
    return ResponseEntity.ok()
        .contentType(contentType)
        .body(AlignmentResponse.from(result));
  }

  @GetMapping("/stats")
  @Operation(summary = "List statistics", description = "Statistics a downsampled interval can "
      + "be reduced to, with their selection flags.")
  public List<StatFlag> stats() {
    return Arrays.stream(Stat.values())
        .map(stat -> new StatFlag(stat.name(), stat.flags(),
            stat.columnLabel("<name>", "<value label>")))
        .toList();
  }

  static String exportName(String originalFilename) {
    String base = StringUtils.hasText(originalFilename)
        ? StringUtils.stripFilenameExtension(StringUtils.getFilename(originalFilename))
        : "alignment";
    return base + EXPORT_SUFFIX;
  }

  private static SourceLayout parseLayout(String value) {
    try {
      return SourceLayout.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("layout",
          "Invalid layout. Supported values: trend,archive,normalized.", 2002);
    }
  }

  private static char parseDelimiter(String value) {
    if (value.length() != 1) {
      throw invalidParameter("delimiter", "Invalid delimiter. Must be a single character.", 2003);
    }
    return value.charAt(0);
  }

  private static Charset parseEncoding(String value) {
    try {
      return Charset.forName(value.trim());
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw invalidParameter("encoding", "Unsupported encoding '" + value + "'.", 2004);
    }
  }

  private static void validateTimeFormat(String value) {
    if (!StringUtils.hasText(value)) {
      return;
    }
    try {
      StrftimeFormat.toFormatter(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("time_format", "Invalid time_format. " + ex.getMessage(), 2005);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("format", "Invalid format value. Supported values: json,csv.", 2006);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode,
        ERROR_DOCS_BASE + errorCode);
  }
}
