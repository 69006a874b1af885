package com.guildshortcuts.service.browser;

import com.guildshortcuts.model.dto.CategoryCount;
import com.guildshortcuts.model.entity.ShortcutEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Browser renderer")
class BrowserRendererTest {

    private static BrowserState.BrowserStateBuilder pagedList(int page, int maxPages) {
        return BrowserState.builder()
                .sessionId("s1")
                .guildId(1L)
                .stage(BrowserStage.PAGED_LIST)
                .prefix("!")
                .pageSize(10)
                .category("Fun")
                .page(page)
                .maxPages(maxPages)
                .lastInteraction(Instant.EPOCH);
    }

    @Test
    @DisplayName("values longer than 1024 characters are cut to fit with an ellipsis")
    void truncatesLongValues() {
        String truncated = BrowserRenderer.truncate("a".repeat(2000));

        assertThat(truncated).hasSize(1024).endsWith("...");
        assertThat(truncated).startsWith("a".repeat(1021));
    }

    @Test
    void valuesAtTheCapAreKept() {
        String value = "b".repeat(1024);

        assertThat(BrowserRenderer.truncate(value)).isSameAs(value);
    }

    @Test
    void pagedListShowsPrefixedTriggersAndOneBasedFooter() {
        BrowserState state = pagedList(1, 3)
                .entries(List.of(ShortcutEntry.builder().name("joke").value("Why did...").build()))
                .build();

        BrowserView view = BrowserRenderer.render(state, null);

        assertThat(view.getTitle()).isEqualTo("Shortcuts in Fun");
        assertThat(view.getLines()).extracting(BrowserLine::getTrigger).containsExactly("!joke");
        assertThat(view.getPage()).isEqualTo(2);
        assertThat(view.getFooter()).isEqualTo("Page 2/3");
        assertThat(view.getActions()).containsExactly(BrowserAction.PREVIOUS, BrowserAction.NEXT, BrowserAction.BACK);
    }

    @Test
    void firstAndLastPageHideTheirArrow() {
        assertThat(BrowserRenderer.allowedActions(pagedList(0, 3).build()))
                .containsExactly(BrowserAction.NEXT, BrowserAction.BACK);
        assertThat(BrowserRenderer.allowedActions(pagedList(2, 3).build()))
                .containsExactly(BrowserAction.PREVIOUS, BrowserAction.BACK);
        assertThat(BrowserRenderer.allowedActions(pagedList(0, 1).build()))
                .containsExactly(BrowserAction.BACK);
    }

    @Test
    void categorySelectListsCounts() {
        BrowserState state = BrowserState.builder()
                .sessionId("s1")
                .guildId(1L)
                .stage(BrowserStage.CATEGORY_SELECT)
                .categories(List.of(CategoryCount.builder().category("Fun").count(2L).build()))
                .lastInteraction(Instant.EPOCH)
                .build();

        BrowserView view = BrowserRenderer.render(state, "hint");

        assertThat(view.getTitle()).isEqualTo("Shortcut categories");
        assertThat(view.getCategories()).extracting(CategoryCount::getCategory).containsExactly("Fun");
        assertThat(view.getNotice()).isEqualTo("hint");
        assertThat(view.getActions()).containsExactly(BrowserAction.SELECT);
    }

    @Test
    void emptyGuildOffersNoActions() {
        BrowserState state = BrowserState.builder()
                .sessionId("s1")
                .guildId(1L)
                .stage(BrowserStage.CATEGORY_SELECT)
                .lastInteraction(Instant.EPOCH)
                .build();

        BrowserView view = BrowserRenderer.render(state, null);

        assertThat(view.getFooter()).isEqualTo("No shortcuts for this server!");
        assertThat(view.getActions()).isEmpty();
    }

    @Test
    @DisplayName("truncation never leaves half of a surrogate pair before the ellipsis")
    void truncationKeepsSurrogatePairsWhole() {
        String emoji = "\uD83D\uDE00";
        String value = "a".repeat(1020) + emoji + "b".repeat(10);

        String truncated = BrowserRenderer.truncate(value);

        assertThat(truncated).isEqualTo("a".repeat(1020) + "...");
        assertThat(Character.isHighSurrogate(truncated.charAt(truncated.length() - 4))).isFalse();
    }

    @Test
    void surrogatePairEndingAtTheCutIsKept() {
        String emoji = "\uD83D\uDE00";
        String value = "a".repeat(1019) + emoji + "b".repeat(10);

        assertThat(BrowserRenderer.truncate(value)).isEqualTo("a".repeat(1019) + emoji + "...");
    }
}
