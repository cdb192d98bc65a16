package org.kpa.tap.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.kpa.tap.models.enums.RunStatus;

import java.time.Instant;
import java.util.Map;

@Setter
@Getter
@Entity
@Table(name = "sync_run", schema = "tap")
public class SyncRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "sync_run_id", nullable = false)
    private Long id;

    @Column(name = "run_uid", nullable = false, length = 40)
    private String runUid;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "run_status", nullable = false, columnDefinition = "tap.run_status")
    @ColumnDefault("'QUEUED'")
    private RunStatus runStatus;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @ColumnDefault("0")
    @Column(name = "records_read")
    private Integer recordsRead;

    @ColumnDefault("0")
    @Column(name = "records_stored")
    private Integer recordsStored;

    @Column(name = "stream_results")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> streamResults;

    @Column(name = "error_message", length = Integer.MAX_VALUE)
    private String errorMessage;
}
