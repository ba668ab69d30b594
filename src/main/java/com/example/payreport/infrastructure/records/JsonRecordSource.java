package com.example.payreport.infrastructure.records;

import com.example.payreport.domain.exception.UnknownPaymentStateException;
import com.example.payreport.domain.model.Creator;
import com.example.payreport.domain.model.PaymentState;
import com.example.payreport.domain.model.Video;
import com.example.payreport.domain.model.VideoFilter;
import com.example.payreport.domain.port.RecordSource;
import com.example.payreport.infrastructure.config.ReportProperties;
import com.example.payreport.infrastructure.exception.RecordSourceException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Record source adapter backed by a JSON snapshot file. The file is read once at startup into
 * immutable lists, so every call returns a consistent snapshot and concurrent readers are safe.
 */
@Component
public class JsonRecordSource implements RecordSource {

    private static final Logger log = LoggerFactory.getLogger(JsonRecordSource.class);

    private final List<Creator> creators;
    private final List<Video> videos;

	/**
	 * Loads the snapshot configured under {@code payreport.records.location}.
	 *
	 * @param resourceLoader resolves {@code classpath:} and {@code file:} locations
	 * @param objectMapper   JSON mapper with Java time support
	 * @param properties     reporting configuration
	 * @throws RecordSourceException when the file is missing or malformed
	 */
    public JsonRecordSource(ResourceLoader resourceLoader, ObjectMapper objectMapper, ReportProperties properties) {
        String location = properties.records().location();
        RecordsDocument document = read(resourceLoader.getResource(location), objectMapper, location);
        this.creators = document.creators() == null ? List.of()
                : document.creators().stream().map(this::toCreator).toList();
        this.videos = document.videos() == null ? List.of()
                : document.videos().stream().map(this::toVideo).toList();
        log.info("Loaded {} creators and {} videos from {}", creators.size(), videos.size(), location);
    }

    @Override
    public List<Creator> listCreators() {
        return creators;
    }

    @Override
    public List<Video> listVideos(VideoFilter filter) {
        if (filter == null) {
            return videos;
        }
        return videos.stream().filter(filter::matches).toList();
    }

    private RecordsDocument read(Resource resource, ObjectMapper objectMapper, String location) {
        if (!resource.exists()) {
            throw new RecordSourceException("Record snapshot not found: " + location, null);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, RecordsDocument.class);
        } catch (IOException ex) {
            throw new RecordSourceException("Unable to read record snapshot " + location, ex);
        }
    }

    private Creator toCreator(CreatorDocument doc) {
        return new Creator(doc.id(), doc.name(), doc.channelLink(), doc.category(), doc.contact(), doc.notes(),
                doc.createdAt());
    }

    private Video toVideo(VideoDocument doc) {
        return new Video(doc.id(), doc.creatorId(), doc.title(), doc.uploadDate(), parseState(doc),
                doc.amount(), doc.link(), doc.description(), doc.createdAt());
    }

	/**
	 * Unreadable states are passed on as {@code null}; the aggregator reports such videos as skipped.
	 */
    private PaymentState parseState(VideoDocument doc) {
        if (doc.paymentStatus() == null || doc.paymentStatus().isBlank()) {
            return null;
        }
        try {
            return PaymentState.fromString(doc.paymentStatus());
        } catch (UnknownPaymentStateException ex) {
            log.warn("Video {} has an unreadable payment status: {}", doc.id(), ex.getMessage());
            return null;
        }
    }

    record RecordsDocument(List<CreatorDocument> creators, List<VideoDocument> videos) {
    }

    record CreatorDocument(Long id,
                           String name,
                           String channelLink,
                           String category,
                           String contact,
                           String notes,
                           LocalDateTime createdAt) {
    }

    record VideoDocument(Long id,
                         Long creatorId,
                         String title,
                         LocalDate uploadDate,
                         String paymentStatus,
                         BigDecimal amount,
                         String link,
                         String description,
                         LocalDateTime createdAt) {
    }
}
