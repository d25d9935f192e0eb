package io.github.yok.forcelink.core;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.enrich.CandidateFieldMapper;
import io.github.yok.forcelink.enrich.CompanyProfile;
import io.github.yok.forcelink.enrich.CompanyScraper;
import io.github.yok.forcelink.exception.ConfigException;
import io.github.yok.forcelink.exception.NotFoundException;
import io.github.yok.forcelink.exception.ScrapeException;
import io.github.yok.forcelink.exception.TransportException;
import io.github.yok.forcelink.mapping.DecisionProvider;
import io.github.yok.forcelink.model.EnrichmentCandidate;
import io.github.yok.forcelink.model.FieldChange;
import io.github.yok.forcelink.model.FieldMapping;
import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.QueryPage;
import io.github.yok.forcelink.model.SourceRow;
import io.github.yok.forcelink.model.SyncSummary;
import io.github.yok.forcelink.sink.CsvErrorSink;
import io.github.yok.forcelink.store.RemoteObjectStore;
import io.github.yok.forcelink.store.SessionProvider;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Enriches one record with contact details found on the web.
 *
 * <p>
 * <strong>Processing flow:</strong> fetch the record, scrape candidate values, diff them against
 * the current values within the allow-list, ask for one confirmation covering the whole diff, and
 * on approval send a single-record update through {@link BatchDispatcher}. Nothing is written
 * when the diff is empty or the confirmation is declined.
 * </p>
 */
@Slf4j
public class EnrichmentPipeline {

    private static final Pattern RECORD_ID = Pattern.compile("[a-zA-Z0-9]{15}([a-zA-Z0-9]{3})?");
    private static final Pattern API_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final RemoteObjectStore store;
    private final SessionProvider sessionProvider;
    private final CompanyScraper scraper;
    private final CandidateFieldMapper candidateMapper;
    private final BatchDispatcher dispatcher;
    private final DecisionProvider decisions;
    private final CsvSettings csvSettings;
    private final Clock clock;

    public EnrichmentPipeline(RemoteObjectStore store, SessionProvider sessionProvider,
            CompanyScraper scraper, BatchDispatcher dispatcher, DecisionProvider decisions,
            CsvSettings csvSettings) {
        this(store, sessionProvider, scraper, new CandidateFieldMapper(), dispatcher, decisions,
                csvSettings, Clock.systemDefaultZone());
    }

    @VisibleForTesting
    EnrichmentPipeline(RemoteObjectStore store, SessionProvider sessionProvider,
            CompanyScraper scraper, CandidateFieldMapper candidateMapper,
            BatchDispatcher dispatcher, DecisionProvider decisions, CsvSettings csvSettings,
            Clock clock) {
        this.store = store;
        this.sessionProvider = sessionProvider;
        this.scraper = scraper;
        this.candidateMapper = candidateMapper;
        this.dispatcher = dispatcher;
        this.decisions = decisions;
        this.csvSettings = csvSettings;
        this.clock = clock;
    }

    /**
     * Runs one enrichment.
     *
     * @param recordId 15 or 18 character record id
     * @param objectType object type, e.g. {@code Account}
     * @param allowedFields fields enrichment may change
     * @return {@code true} if an update was sent and accepted
     * @throws ConfigException if an argument is malformed
     * @throws NotFoundException if the record does not exist
     */
    public boolean enrich(String recordId, String objectType, Set<String> allowedFields) {
        validate(recordId, objectType, allowedFields);
        Map<String, String> record = fetchRecord(recordId, objectType, allowedFields);

        String searchKey = searchKey(record);
        CompanyProfile profile;
        try {
            profile = scraper.scrape(searchKey);
        } catch (ScrapeException e) {
            log.warn("Enrichment of {} {} skipped: {}", objectType, recordId, e.getMessage());
            return false;
        }

        Map<String, String> current = new LinkedHashMap<>();
        allowedFields.forEach(field -> current.put(field, record.get(field)));
        EnrichmentCandidate candidate = new EnrichmentCandidate(recordId, objectType, current,
                candidateMapper.toFieldValues(objectType, profile), allowedFields);
        List<FieldChange> diff = candidate.diff();
        if (diff.isEmpty()) {
            log.info("No changes found for {} {}", objectType, recordId);
            return false;
        }
        if (!decisions.confirm(diff)) {
            log.info("Update of {} {} declined", objectType, recordId);
            return false;
        }
        return applyUpdate(recordId, objectType, diff);
    }

    private static void validate(String recordId, String objectType, Set<String> allowedFields) {
        if (recordId == null || !RECORD_ID.matcher(recordId).matches()) {
            throw new ConfigException("Invalid record id: " + recordId);
        }
        if (objectType == null || !API_NAME.matcher(objectType).matches()) {
            throw new ConfigException("Invalid object type: " + objectType);
        }
        if (allowedFields == null || allowedFields.isEmpty()) {
            throw new ConfigException("No enrichable fields configured for " + objectType);
        }
        for (String field : allowedFields) {
            if (!API_NAME.matcher(field).matches()) {
                throw new ConfigException("Invalid field name: " + field);
            }
        }
    }

    private Map<String, String> fetchRecord(String recordId, String objectType,
            Set<String> allowedFields) {
        Set<String> fields = new LinkedHashSet<>();
        fields.add("Id");
        fields.add("Name");
        fields.addAll(allowedFields);
        String soql = "SELECT " + String.join(", ", fields) + " FROM " + objectType
                + " WHERE Id = '" + recordId + "'";
        QueryPage page;
        try {
            page = store.query(sessionProvider.acquire(), soql);
        } catch (TransportException e) {
            if (!e.isSessionExpired()) {
                throw e;
            }
            page = store.query(sessionProvider.reauthenticate(), soql);
        }
        if (page.getRecords().isEmpty()) {
            throw new NotFoundException(objectType + " " + recordId + " not found");
        }
        return page.getRecords().get(0);
    }

    /**
     * Picks the search key: the record name, else the domain of its web site or e-mail.
     *
     * @param record fetched record
     * @return search key, or {@code null} if none is available
     */
    @VisibleForTesting
    static String searchKey(Map<String, String> record) {
        String name = StringUtils.trimToNull(record.get("Name"));
        if (name != null) {
            return name;
        }
        String website = StringUtils.trimToNull(record.get("Website"));
        if (website != null) {
            String host = website.contains("://") ? StringUtils.substringAfter(website, "://")
                    : website;
            host = StringUtils.substringBefore(host, "/").toLowerCase(Locale.ROOT);
            return StringUtils.removeStart(host, "www.");
        }
        String email = StringUtils.trimToNull(record.get("Email"));
        if (email != null && email.contains("@")) {
            return StringUtils.substringAfterLast(email, "@").toLowerCase(Locale.ROOT);
        }
        return null;
    }

    private boolean applyUpdate(String recordId, String objectType, List<FieldChange> diff) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("Id", recordId);
        diff.forEach(change -> values.put(change.getField(), change.getProposedValue()));
        List<String> columns = new ArrayList<>(values.keySet());
        log.debug("Updating {} {} with {}", objectType, recordId, values);

        SyncSummary summary;
        try (CsvErrorSink errorSink = new CsvErrorSink(csvSettings,
                "enrich_" + objectType + "_" + recordId, columns, clock)) {
            summary = dispatcher.dispatch(DispatchRequest.builder().objectName(objectType)
                    .operation(Operation.UPDATE).rows(ImmutableList.of(new SourceRow(1, values)))
                    .fieldMapping(FieldMapping.identity(columns)).batchSize(1)
                    .errorSink(errorSink).build());
        }
        boolean applied = summary.getSucceeded() == 1;
        if (applied) {
            log.info("Updated {} {}: {}", objectType, recordId, values.keySet());
        } else {
            log.error("Update of {} {} failed; see {}", objectType, recordId,
                    summary.getErrorFileIfAny().map(Object::toString).orElse("the log"));
        }
        return applied;
    }
}
