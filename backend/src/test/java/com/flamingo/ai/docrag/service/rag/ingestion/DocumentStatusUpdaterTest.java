package com.flamingo.ai.docrag.service.rag.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docrag.domain.entity.Document;
import com.flamingo.ai.docrag.domain.enums.DocumentStatus;
import com.flamingo.ai.docrag.domain.repository.DocumentRepository;
import com.flamingo.ai.docrag.exception.DocumentNotFoundException;
import com.flamingo.ai.docrag.exception.ErrorKind;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

@ExtendWith(MockitoExtension.class)
class DocumentStatusUpdaterTest {

  @Mock private DocumentRepository documentRepository;

  private DocumentStatusUpdater statusUpdater;
  private Document document;

  @BeforeEach
  void setUp() {
    statusUpdater = new DocumentStatusUpdater(documentRepository);
    document = Document.builder().fileId("file_1").fileName("notes.txt").build();
  }

  @Test
  void shouldMarkReadyWithCounts() {
    when(documentRepository.findById("file_1")).thenReturn(Optional.of(document));
    when(documentRepository.saveAndFlush(any(Document.class)))
        .thenAnswer(inv -> inv.getArgument(0));

    Document result = statusUpdater.markReady("file_1", 4, 4);

    assertThat(result.getStatus()).isEqualTo(DocumentStatus.READY);
    assertThat(result.getChunksCount()).isEqualTo(4);
    assertThat(result.getVectorsCount()).isEqualTo(4);
    assertThat(result.getProcessedAt()).isNotNull();
  }

  @Test
  void shouldMarkFailedWithKind() {
    when(documentRepository.findById("file_1")).thenReturn(Optional.of(document));
    when(documentRepository.saveAndFlush(any(Document.class)))
        .thenAnswer(inv -> inv.getArgument(0));

    Document result = statusUpdater.markFailed("file_1", ErrorKind.PROVIDER, "quota exceeded");

    assertThat(result.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(result.getErrorKind()).isEqualTo(ErrorKind.PROVIDER);
    assertThat(result.getProcessingError()).isEqualTo("quota exceeded");
  }

  @Test
  void shouldRetry_whenDatabaseIsLocked() {
    when(documentRepository.findById("file_1"))
        .thenAnswer(
            inv -> Optional.of(Document.builder().fileId("file_1").fileName("a.txt").build()));
    when(documentRepository.saveAndFlush(any(Document.class)))
        .thenThrow(new CannotAcquireLockException("database is locked"))
        .thenAnswer(inv -> inv.getArgument(0));

    Document result = statusUpdater.markReady("file_1", 1, 1);

    assertThat(result.getStatus()).isEqualTo(DocumentStatus.READY);
    verify(documentRepository, times(2)).findById("file_1");
  }

  @Test
  void shouldGiveUp_afterThreeLockedAttempts() {
    when(documentRepository.findById("file_1"))
        .thenAnswer(
            inv -> Optional.of(Document.builder().fileId("file_1").fileName("a.txt").build()));
    when(documentRepository.saveAndFlush(any(Document.class)))
        .thenThrow(new CannotAcquireLockException("database is locked"));

    assertThatThrownBy(() -> statusUpdater.markReady("file_1", 1, 1))
        .isInstanceOf(CannotAcquireLockException.class);
    verify(documentRepository, times(3)).saveAndFlush(any(Document.class));
  }

  @Test
  void shouldThrowNotFound_whenDocumentMissing() {
    when(documentRepository.findById("file_9")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> statusUpdater.markFailed("file_9", ErrorKind.INTERNAL, "boom"))
        .isInstanceOf(DocumentNotFoundException.class);
  }
}
