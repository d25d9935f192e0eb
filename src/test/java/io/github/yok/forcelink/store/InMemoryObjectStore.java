package io.github.yok.forcelink.store;

import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.QueryPage;
import io.github.yok.forcelink.model.RecordOutcome;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * In-memory {@link RemoteObjectStore} for unit tests.
 *
 * <p>
 * Every bulk call is recorded as a {@link Submission}. Outcomes come from {@link #outcomeRule}
 * (success with a generated id when unset). Failures queued with {@link #failNextCall} are thrown
 * by the following calls, one per call.
 * </p>
 */
public class InMemoryObjectStore implements RemoteObjectStore {

    /**
     * One recorded bulk call.
     */
    @Value
    public static class Submission {
        Operation operation;
        String objectName;
        String externalIdField;
        List<Map<String, String>> records;

        public int size() {
            return records.size();
        }
    }

    private final List<Submission> submissions = new ArrayList<>();
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private final Deque<QueryPage> pages = new ArrayDeque<>();
    private final List<String> queries = new ArrayList<>();
    private Function<Map<String, String>, RecordOutcome> outcomeRule;
    private Set<String> describedFields = new LinkedHashSet<>();
    private RuntimeException describeFailure;
    private int idSequence;

    public List<Submission> getSubmissions() {
        return submissions;
    }

    public List<String> getQueries() {
        return queries;
    }

    public void setOutcomeRule(Function<Map<String, String>, RecordOutcome> outcomeRule) {
        this.outcomeRule = outcomeRule;
    }

    public void setDescribedFields(Set<String> describedFields) {
        this.describedFields = describedFields;
    }

    public void setDescribeFailure(RuntimeException describeFailure) {
        this.describeFailure = describeFailure;
    }

    public void failNextCall(RuntimeException failure) {
        failures.add(failure);
    }

    public void addPage(QueryPage page) {
        pages.add(page);
    }

    @Override
    public List<RecordOutcome> insert(Session session, String objectName,
            List<Map<String, String>> records) {
        return record(Operation.INSERT, objectName, null, records);
    }

    @Override
    public List<RecordOutcome> update(Session session, String objectName,
            List<Map<String, String>> records) {
        return record(Operation.UPDATE, objectName, null, records);
    }

    @Override
    public List<RecordOutcome> upsert(Session session, String objectName, String externalIdField,
            List<Map<String, String>> records) {
        return record(Operation.UPSERT, objectName, externalIdField, records);
    }

    @Override
    public List<RecordOutcome> delete(Session session, List<String> ids) {
        List<Map<String, String>> records = new ArrayList<>();
        for (String id : ids) {
            Map<String, String> record = new LinkedHashMap<>();
            record.put("Id", id);
            records.add(record);
        }
        return record(Operation.DELETE, null, null, records);
    }

    @Override
    public QueryPage query(Session session, String soql) {
        queries.add(soql);
        return nextPage();
    }

    @Override
    public QueryPage queryMore(Session session, String nextToken) {
        queries.add(nextToken);
        return nextPage();
    }

    @Override
    public Set<String> describeFields(Session session, String objectName) {
        if (describeFailure != null) {
            throw describeFailure;
        }
        return describedFields;
    }

    private QueryPage nextPage() {
        if (!failures.isEmpty()) {
            throw failures.poll();
        }
        if (pages.isEmpty()) {
            return new QueryPage(List.of(), List.of(), null);
        }
        return pages.poll();
    }

    private List<RecordOutcome> record(Operation operation, String objectName,
            String externalIdField, List<Map<String, String>> records) {
        submissions.add(new Submission(operation, objectName, externalIdField,
                new ArrayList<>(records)));
        if (!failures.isEmpty()) {
            throw failures.poll();
        }
        return records.stream().map(this::outcomeOf).collect(Collectors.toList());
    }

    private RecordOutcome outcomeOf(Map<String, String> record) {
        if (outcomeRule != null) {
            return outcomeRule.apply(record);
        }
        idSequence++;
        return RecordOutcome.succeeded(String.format("001%015d", idSequence));
    }
}
