package org.kpa.tap.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Setter
@Getter
@Entity
@Table(name = "extracted_record", schema = "tap",
        uniqueConstraints = @UniqueConstraint(columnNames = {"stream_name", "record_key", "payload_hash"}))
public class ExtractedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "extracted_record_id", nullable = false)
    private Long id;

    @Column(name = "record_uid", nullable = false, length = 40)
    private String recordUid;

    @ManyToOne(fetch = FetchType.LAZY)
    @OnDelete(action = OnDeleteAction.SET_NULL)
    @JoinColumn(name = "sync_run_id")
    private SyncRun syncRun;

    @Column(name = "stream_name", nullable = false)
    private String streamName;

    @Column(name = "record_key", nullable = false)
    private String recordKey;

    @Column(name = "payload", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    @Column(name = "payload_hash", nullable = false, length = 64)
    private String payloadHash;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
