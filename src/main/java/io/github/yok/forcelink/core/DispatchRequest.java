package io.github.yok.forcelink.core;

import io.github.yok.forcelink.model.FieldMapping;
import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.SourceRow;
import io.github.yok.forcelink.sink.ErrorSink;
import io.github.yok.forcelink.sink.SuccessSink;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one dispatch run needs.
 */
@Value
@Builder
public class DispatchRequest {

    @NonNull
    String objectName;

    @NonNull
    Operation operation;

    // Source rows in file order
    @NonNull
    List<SourceRow> rows;

    @NonNull
    FieldMapping fieldMapping;

    int batchSize;

    // Upsert only
    String externalIdField;

    @NonNull
    ErrorSink errorSink;

    @Builder.Default
    SuccessSink successSink = SuccessSink.NONE;
}
