package eu.lieko.store.record;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RecordEntry {

    private final String id;
    private final DataRecord record;
}
