package org.kpa.tap.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

@Setter
@Getter
@Entity
@Table(name = "stream_bookmark", schema = "tap")
public class StreamBookmark {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "bookmark_id", nullable = false)
    private Long id;

    @Column(name = "stream_name", nullable = false, unique = true)
    private String streamName;

    @Column(name = "form_id")
    private String formId;

    @Column(name = "replication_key", nullable = false, length = 60)
    private String replicationKey;

    @Column(name = "replication_value")
    private Instant replicationValue;

    @ColumnDefault("now()")
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
