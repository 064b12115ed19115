package com.stealerlens.normalization;

import com.stealerlens.domain.BatchResult;
import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.domain.RawFile;
import com.stealerlens.domain.StealerFamily;
import com.stealerlens.domain.SystemInfoField;
import com.stealerlens.normalization.parsers.ParseException;
import com.stealerlens.normalization.parsers.ParserRegistry;
import com.stealerlens.normalization.parsers.SystemInfoParser;
import com.stealerlens.storage.SystemInformationRepository;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Normalization service for the system information files of one device's log archive.
 *
 * Each file is detected, parsed by its family's parser, cleaned and stored on its own:
 * a failure is recorded in the {@link BatchResult} and the batch moves on.
 */
@Service
public class SystemInformationService {

    private static final Logger log = LoggerFactory.getLogger(SystemInformationService.class);

    private final EncodingNormalizer encodingNormalizer;
    private final SignatureDetector signatureDetector;
    private final ParserRegistry parserRegistry;
    private final DateTimeNormalizer dateTimeNormalizer;
    private final SystemInformationRepository repository;
    private final NormalizationMetrics metrics;
    private final List<String> fileNamePatterns;
    private final ExecutorService executor;

    public SystemInformationService(
            EncodingNormalizer encodingNormalizer,
            SignatureDetector signatureDetector,
            ParserRegistry parserRegistry,
            DateTimeNormalizer dateTimeNormalizer,
            SystemInformationRepository repository,
            NormalizationMetrics metrics,
            @Value("${stealerlens.system-info.file-patterns:system,information,userinfo,user_info,systeminfo,system_info,info}")
            List<String> fileNamePatterns,
            @Value("${stealerlens.batch.parallelism:1}") int parallelism) {
        this.encodingNormalizer = encodingNormalizer;
        this.signatureDetector = signatureDetector;
        this.parserRegistry = parserRegistry;
        this.dateTimeNormalizer = dateTimeNormalizer;
        this.repository = repository;
        this.metrics = metrics;
        this.fileNamePatterns = fileNamePatterns.stream()
            .map(pattern -> pattern.strip().toLowerCase(Locale.ROOT))
            .filter(pattern -> !pattern.isEmpty())
            .toList();
        this.executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
        log.info("SystemInformationService initialized (patterns={}, parallelism={})",
            this.fileNamePatterns, Math.max(parallelism, 1));
    }

    /**
     * Process the system information files of one device.
     *
     * @param deviceId device the files belong to
     * @param files    every text file of the archive; non system information files are skipped
     * @return success and failure counts with one error entry per failed file, in input order
     */
    public BatchResult processFiles(String deviceId, List<RawFile> files) {
        List<RawFile> selected = selectSystemInfoFiles(files);
        log.info("Processing {} system information files for device {}", selected.size(), deviceId);

        BatchResult result = new BatchResult();
        if (executor == null) {
            for (RawFile file : selected) {
                result.merge(processFile(deviceId, file));
            }
        } else {
            List<CompletableFuture<BatchResult>> futures = new ArrayList<>(selected.size());
            for (RawFile file : selected) {
                futures.add(CompletableFuture.supplyAsync(() -> processFile(deviceId, file), executor));
            }
            for (CompletableFuture<BatchResult> future : futures) {
                result.merge(future.join());
            }
        }

        log.info("Processing complete for device {}: {} success, {} failed",
            deviceId, result.getSuccess(), result.getFailed());
        return result;
    }

    /**
     * Files whose lower-cased name contains one of the configured patterns.
     */
    public List<RawFile> selectSystemInfoFiles(List<RawFile> files) {
        List<RawFile> selected = new ArrayList<>();
        for (RawFile file : files) {
            String lowerName = file.getFileName().toLowerCase(Locale.ROOT);
            if (fileNamePatterns.stream().anyMatch(lowerName::contains)) {
                selected.add(file);
            }
        }
        return selected;
    }

    /**
     * Detect, parse and clean one file without storing it.
     *
     * @throws ParseException if the parser fails
     */
    public ParsedSystemInfo normalize(RawFile file) {
        // 1. Normalize encoding
        String content = encodingNormalizer.normalize(file.getContent());

        // 2. Detect stealer family
        StealerFamily family = signatureDetector.detect(content, file.getFileName());
        log.debug("Detected stealer type {} for file {}", family.getTag(), file.getFileName());

        // 3. Get appropriate parser
        SystemInfoParser parser = parserRegistry.getParser(family);

        // 4. Parse
        ParsedSystemInfo parsed = parser.parse(content, file.getFileName());
        parsed.setStealerType(family.getTag());

        // 5. Clean values and normalize the log date
        clean(parsed);
        return parsed.seal();
    }

    private BatchResult processFile(String deviceId, RawFile file) {
        BatchResult outcome = new BatchResult();
        Timer.Sample sample = metrics.startTimer();
        String stealerType = StealerFamily.GENERIC.getTag();
        try {
            ParsedSystemInfo parsed = normalize(file);
            stealerType = parsed.getStealerType();

            repository.saveSystemInformation(deviceId, parsed, file.getFileName());

            outcome.recordSuccess();
            metrics.recordParsed(stealerType);
            log.debug("Parsed and stored {} for device {}", file.getFileName(), deviceId);

        } catch (ParseException e) {
            log.error("Failed to parse {} for device {}: {}", file.getFileName(), deviceId, e.getMessage(), e);
            outcome.recordFailure(file.getFileName(), "Parse failed: " + e.getMessage());
            metrics.recordFailed(e.getStealerType() != null ? e.getStealerType() : stealerType);

        } catch (Exception e) {
            log.error("Unexpected error processing {} for device {}", file.getFileName(), deviceId, e);
            outcome.recordFailure(file.getFileName(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            metrics.recordFailed(stealerType);

        } finally {
            metrics.recordLatency(sample);
        }
        return outcome;
    }

    private void clean(ParsedSystemInfo parsed) {
        for (SystemInfoField field : SystemInfoField.values()) {
            if (field != SystemInfoField.LOG_DATE) {
                parsed.replace(field, LineGrammar.cleanValue(parsed.get(field)));
            }
        }
        NormalizedDateTime dateTime = dateTimeNormalizer.normalize(LineGrammar.cleanValue(parsed.get(SystemInfoField.LOG_DATE)));
        parsed.replace(SystemInfoField.LOG_DATE, dateTime.getDate());
        parsed.setLogTime(dateTime.getTime());
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }
}
