package dev.scriptorium.version;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.scriptorium.catalog.ArtifactCatalogReader;
import dev.scriptorium.catalog.CatalogUnavailableException;
import dev.scriptorium.catalog.IndexVersion;
import dev.scriptorium.catalog.VersionStatus;
import dev.scriptorium.fixture.IndexVersionBuilder;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VersionSelectorTest {

  @Mock ArtifactCatalogReader catalogReader;

  ActiveVersionPointer pointer;
  VersionSelector selector;

  @BeforeEach
  void setUp() {
    pointer = new ActiveVersionPointer();
    selector = new VersionSelector(catalogReader, pointer);
  }

  private static List<IndexVersion> mixedCatalog() {
    return List.of(
        new IndexVersionBuilder().id("v1").ready().createdAt(1).build(),
        new IndexVersionBuilder().id("v2").failed().createdAt(2).build(),
        new IndexVersionBuilder().id("v3").ready().createdAt(3).build());
  }

  @Test
  void selectsLatestReadyVersion() {
    assertThat(selector.selectLatestReady(mixedCatalog()))
        .map(IndexVersion::versionId)
        .contains("v3");
  }

  @Test
  void skipsNewerVersionsThatAreNotReady() {
    List<IndexVersion> versions =
        List.of(
            new IndexVersionBuilder().id("v1").ready().createdAt(1).build(),
            new IndexVersionBuilder().id("v2").status(VersionStatus.RUNNING).createdAt(5).build(),
            new IndexVersionBuilder().id("v3").status(VersionStatus.PENDING).createdAt(6).build());

    assertThat(selector.selectLatestReady(versions)).map(IndexVersion::versionId).contains("v1");
  }

  @Test
  void noReadyVersionYieldsEmpty() {
    assertThat(selector.selectLatestReady(List.of())).isEmpty();
    assertThat(
            selector.selectLatestReady(
                List.of(new IndexVersionBuilder().id("v1").failed().build())))
        .isEmpty();
  }

  @Test
  void equalCreationTimeGoesToGreatestVersionId() {
    List<IndexVersion> versions =
        List.of(
            new IndexVersionBuilder().id("b").ready().createdAt(10).build(),
            new IndexVersionBuilder().id("c").ready().createdAt(10).build(),
            new IndexVersionBuilder().id("a").ready().createdAt(10).build());

    assertThat(selector.selectLatestReady(versions)).map(IndexVersion::versionId).contains("c");
  }

  @Test
  void applyMovesPointerAndReportsPrevious() {
    VersionSwitch first = selector.apply("v1");
    VersionSwitch second = selector.apply("v3");

    assertThat(first.previousVersionId()).isNull();
    assertThat(second.previousVersionId()).isEqualTo("v1");
    assertThat(second.appliedVersionId()).isEqualTo("v3");
    assertThat(pointer.get()).contains("v3");
  }

  @Test
  void applyingActiveVersionAgainIsNoOp() {
    selector.apply("v3");

    VersionSwitch again = selector.apply("v3");

    assertThat(again.unchanged()).isTrue();
    assertThat(pointer.require()).isEqualTo("v3");
  }

  @Test
  void applyRejectsBlankId() {
    assertThatThrownBy(() -> selector.apply("  ")).isInstanceOf(IllegalArgumentException.class);
    assertThat(pointer.get()).isEmpty();
  }

  @Test
  void applyLatestReadyActivatesNewestReadyVersion() {
    given(catalogReader.listVersions()).willReturn(mixedCatalog());

    Optional<VersionSwitch> change = selector.applyLatestReady();

    assertThat(change).map(VersionSwitch::appliedVersionId).contains("v3");
    assertThat(pointer.require()).isEqualTo("v3");
  }

  @Test
  void applyLatestReadyLeavesPointerWhenNothingIsReady() {
    selector.apply("v1");
    given(catalogReader.listVersions())
        .willReturn(List.of(new IndexVersionBuilder().id("v2").failed().createdAt(9).build()));

    assertThat(selector.applyLatestReady()).isEmpty();
    assertThat(pointer.require()).isEqualTo("v1");
  }

  @Test
  void applyLatestReadyPropagatesCatalogOutage() {
    given(catalogReader.listVersions())
        .willThrow(new CatalogUnavailableException("listing failed", new RuntimeException()));

    assertThatThrownBy(() -> selector.applyLatestReady())
        .isInstanceOf(CatalogUnavailableException.class);
    assertThat(pointer.get()).isEmpty();
  }

  @Test
  void applyIfReadyActivatesListedReadyVersion() {
    given(catalogReader.listVersions()).willReturn(mixedCatalog());

    VersionSwitch change = selector.applyIfReady(" v1 ");

    assertThat(change.appliedVersionId()).isEqualTo("v1");
    assertThat(pointer.require()).isEqualTo("v1");
  }

  @Test
  void applyIfReadyRejectsFailedVersion() {
    given(catalogReader.listVersions()).willReturn(mixedCatalog());

    assertThatThrownBy(() -> selector.applyIfReady("v2"))
        .isInstanceOf(VersionNotReadyException.class)
        .hasMessageContaining("FAILED")
        .satisfies(
            e ->
                assertThat(((VersionNotReadyException) e).getObservedStatus())
                    .isEqualTo(VersionStatus.FAILED));
    assertThat(pointer.get()).isEmpty();
  }

  @Test
  void applyIfReadyRejectsUnknownVersion() {
    given(catalogReader.listVersions()).willReturn(mixedCatalog());

    assertThatThrownBy(() -> selector.applyIfReady("v9"))
        .isInstanceOf(VersionNotReadyException.class)
        .hasMessageContaining("not listed");
  }

  @Test
  void applyIfReadyRejectsBlankIdWithoutReadingCatalog() {
    assertThatThrownBy(() -> selector.applyIfReady("")).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(catalogReader);
  }
}
