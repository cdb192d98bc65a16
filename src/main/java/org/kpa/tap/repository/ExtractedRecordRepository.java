package org.kpa.tap.repository;

import org.kpa.tap.models.entity.ExtractedRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ExtractedRecordRepository extends JpaRepository<ExtractedRecord, Long> {

    List<RecordVersion> findByStreamNameAndRecordKeyIn(String streamName, Collection<String> recordKeys);

    interface RecordVersion {
        String getRecordKey();

        String getPayloadHash();
    }
}
