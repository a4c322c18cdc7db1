package com.team.formtest.model.entity;

import com.team.formtest.model.run.ScreenshotStage;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "form_test_screenshot")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenshotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "test_run_id")
    private TestRunRecord testRun;

    @Enumerated(EnumType.STRING)
    private ScreenshotStage stage;

    /** Storage reference, a file path for Playwright captures */
    @Column(length = 1000)
    private String reference;

    private LocalDateTime capturedAt;
}
