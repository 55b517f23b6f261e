package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateDesignerRequest;
import com.designgrowth.backend.dto.request.CreateGuildRequest;
import com.designgrowth.backend.dto.request.CreateMentorshipRequest;
import com.designgrowth.backend.dto.request.CreateNotificationRequest;
import com.designgrowth.backend.dto.request.CreateProjectRequest;
import com.designgrowth.backend.dto.request.CreateResourceRequest;
import com.designgrowth.backend.dto.request.CreateReviewRequest;
import com.designgrowth.backend.model.CalendarEntry;
import com.designgrowth.backend.model.Designer;
import com.designgrowth.backend.model.Guild;
import com.designgrowth.backend.model.Mentorship;
import com.designgrowth.backend.model.Notification;
import com.designgrowth.backend.model.Project;
import com.designgrowth.backend.model.Review;
import com.designgrowth.backend.model.TrainingResource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Defaults each mapper fills in when the client leaves a field out.
 */
class DocumentDefaultsTest {

    @Nested
    class Designers {
        private final DesignerMapper mapper = new DesignerMapper();

        @Test
        @DisplayName("a new designer starts at Junior with no guilds")
        void defaults() {
            Designer designer = mapper.toDocument(CreateDesignerRequest.builder()
                    .name("Ada").email("ada@x.com").build());

            assertThat(designer.getName()).isEqualTo("Ada");
            assertThat(designer.getEmail()).isEqualTo("ada@x.com");
            assertThat(designer.getCurrentLevel()).isEqualTo("Junior");
            assertThat(designer.getGuilds()).isEmpty();
            assertThat(designer.getManagerId()).isNull();
        }

        @Test
        void keepsSuppliedLevelAndGuilds() {
            Designer designer = mapper.toDocument(CreateDesignerRequest.builder()
                    .name("Grace").email("grace@x.com").managerId("m1")
                    .currentLevel("Senior").guilds(List.of("g1")).build());

            assertThat(designer.getCurrentLevel()).isEqualTo("Senior");
            assertThat(designer.getGuilds()).containsExactly("g1");
            assertThat(designer.getManagerId()).isEqualTo("m1");
        }
    }

    @Nested
    class Reviews {
        private final ReviewMapper mapper = new ReviewMapper();

        @Test
        void defaultsToOpenWithNoPeerEvals() {
            Review review = mapper.toDocument(CreateReviewRequest.builder()
                    .designerId("d1").cycle("2025-H1").build());

            assertThat(review.getStatus()).isEqualTo("open");
            assertThat(review.getPeerEvals()).isEmpty();
            assertThat(review.getSelfEval()).isNull();
        }

        @Test
        void carriesEvaluations() {
            Review review = mapper.toDocument(CreateReviewRequest.builder()
                    .designerId("d1").cycle("2025-H1").status("closed")
                    .selfEval(Map.of("impact", 3))
                    .peerEvals(List.of(Map.of("impact", 2), Map.of("impact", 4)))
                    .managerEval(Map.of("impact", 3))
                    .summary("Solid")
                    .build());

            assertThat(review.getStatus()).isEqualTo("closed");
            assertThat(review.getPeerEvals()).hasSize(2);
            assertThat(review.getManagerEval()).containsEntry("impact", 3);
            assertThat(review.getSummary()).isEqualTo("Solid");
        }
    }

    @Test
    void guildCalendarDefaultsToEmpty() {
        GuildMapper mapper = new GuildMapper();

        Guild empty = mapper.toDocument(CreateGuildRequest.builder().name("Research").build());
        Guild scheduled = mapper.toDocument(CreateGuildRequest.builder().name("Research")
                .calendar(List.of(new CalendarEntry("2025-07-01", "Kickoff"))).build());

        assertThat(empty.getCalendar()).isEmpty();
        assertThat(scheduled.getCalendar()).extracting(CalendarEntry::getTitle).containsExactly("Kickoff");
    }

    @Test
    void mentorshipIsActiveWithNoActivities() {
        Mentorship mentorship = new MentorshipMapper().toDocument(CreateMentorshipRequest.builder()
                .mentorId("m1").menteeId("d1").startDate(LocalDate.of(2025, 1, 15)).build());

        assertThat(mentorship.getStatus()).isEqualTo("active");
        assertThat(mentorship.getActivities()).isEmpty();
        assertThat(mentorship.getStartDate()).isEqualTo(LocalDate.of(2025, 1, 15));
    }

    @Test
    void resourceTagsDefaultToEmpty() {
        TrainingResource resource = new ResourceMapper().toDocument(CreateResourceRequest.builder()
                .title("Typography basics").url("https://example.com/type").durationMinutes(45).build());

        assertThat(resource.getTags()).isEmpty();
        assertThat(resource.getDurationMinutes()).isEqualTo(45);
        assertThat(resource.getProvider()).isNull();
    }

    @Test
    void projectDesignersAndStagesDefaultToEmpty() {
        Project project = new ProjectMapper().toDocument(CreateProjectRequest.builder()
                .name("Checkout redesign").managerId("m1").build());

        assertThat(project.getDesigners()).isEmpty();
        assertThat(project.getStages()).isEmpty();
        assertThat(project.getManagerId()).isEqualTo("m1");
    }

    @Test
    void notificationSentViaDefaultsToEmpty() {
        Notification notification = new NotificationMapper().toDocument(CreateNotificationRequest.builder()
                .userId("d1").kind("goal_due").message("Your goal is due Friday").build());

        assertThat(notification.getSentVia()).isEmpty();
        assertThat(notification.getKind()).isEqualTo("goal_due");
    }
}
