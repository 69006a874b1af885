package com.guildshortcuts.service.browser;

import com.guildshortcuts.cache.ConfigCache;
import com.guildshortcuts.cache.SettingsKey;
import com.guildshortcuts.exception.BrowserExpiredException;
import com.guildshortcuts.exception.NotFoundException;
import com.guildshortcuts.exception.ValidationException;
import com.guildshortcuts.model.dto.CategoryCount;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import com.guildshortcuts.service.ShortcutStore;
import com.guildshortcuts.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.PageImpl;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Category browser")
class CategoryBrowserTest {

    private static final long GUILD = 5L;

    @Mock
    private ShortcutStore shortcutStore;

    @Mock
    private ConfigCache<SettingsKey, GuildSettings> settingsCache;

    private MutableClock clock;
    private CategoryBrowser browser;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        browser = new CategoryBrowser(shortcutStore, settingsCache, new BrowserSessionRegistry(clock, 300));

        when(settingsCache.queryOne(new SettingsKey(GUILD))).thenReturn(Optional.of(GuildSettings.builder()
                .guildId(GUILD)
                .prefix("!")
                .pageSize(2)
                .build()));
        when(shortcutStore.countByCategory(GUILD)).thenReturn(List.of(
                CategoryCount.builder().category("Fun").count(5L).build(),
                CategoryCount.builder().category("General").count(1L).build()));
        when(shortcutStore.countInCategory(GUILD, "Fun")).thenReturn(5L);
        when(shortcutStore.findPage(eq(GUILD), eq("Fun"), anyInt(), eq(2))).thenAnswer(invocation -> {
            int page = invocation.getArgument(2);
            return new PageImpl<>(IntStream.range(page * 2, Math.min(page * 2 + 2, 5))
                    .mapToObj(i -> ShortcutEntry.builder().guildId(GUILD).name("s" + i).value("v" + i)
                            .category("Fun").build())
                    .toList());
        });
    }

    private BrowserView openFun() {
        BrowserView opened = browser.open(GUILD);
        return browser.select(opened.getSessionId(), GUILD, "Fun");
    }

    @Test
    void openListsCategoriesFromStore() {
        BrowserView view = browser.open(GUILD);

        assertThat(view.getStage()).isEqualTo(BrowserStage.CATEGORY_SELECT);
        assertThat(view.getCategories())
                .extracting(CategoryCount::getCategory, CategoryCount::getCount)
                .containsExactly(tuple("Fun", 5L),
                        tuple("General", 1L));
        assertThat(view.getSessionId()).isNotBlank();
    }

    @Test
    @DisplayName("selecting a category shows its first page with the page count rounded up")
    void selectShowsFirstPage() {
        BrowserView view = openFun();

        assertThat(view.getStage()).isEqualTo(BrowserStage.PAGED_LIST);
        assertThat(view.getPage()).isEqualTo(1);
        assertThat(view.getMaxPages()).isEqualTo(3);
        assertThat(view.getLines()).extracting(BrowserLine::getTrigger).containsExactly("!s0", "!s1");
    }

    @Test
    void selectUnknownCategory() {
        when(shortcutStore.countInCategory(GUILD, "Nope")).thenReturn(0L);
        BrowserView opened = browser.open(GUILD);

        assertThatThrownBy(() -> browser.select(opened.getSessionId(), GUILD, "Nope"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("Existing categories: Fun, General");
    }

    @Nested
    @DisplayName("Paging")
    class Paging {

        @Test
        void nextAndPreviousWalkThePages() {
            String session = openFun().getSessionId();

            assertThat(browser.next(session, GUILD).getLines())
                    .extracting(BrowserLine::getTrigger).containsExactly("!s2", "!s3");
            BrowserView last = browser.next(session, GUILD);
            assertThat(last.getLines()).extracting(BrowserLine::getTrigger).containsExactly("!s4");
            assertThat(last.getFooter()).isEqualTo("Page 3/3");

            assertThat(browser.previous(session, GUILD).getPage()).isEqualTo(2);
        }

        @Test
        @DisplayName("next on the last page is a no-op")
        void nextOnLastPage() {
            String session = openFun().getSessionId();
            browser.next(session, GUILD);
            browser.next(session, GUILD);
            clearInvocations(shortcutStore);

            BrowserView view = browser.next(session, GUILD);

            assertThat(view.getPage()).isEqualTo(3);
            assertThat(view.getNotice()).isEqualTo("Already on the last page.");
            verify(shortcutStore, never()).findPage(anyLong(), anyString(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("previous on the first page is a no-op")
        void previousOnFirstPage() {
            String session = openFun().getSessionId();

            BrowserView view = browser.previous(session, GUILD);

            assertThat(view.getPage()).isEqualTo(1);
            assertThat(view.getNotice()).isEqualTo("Already on the first page.");
        }

        @Test
        void backReturnsToRecomputedCategories() {
            String session = openFun().getSessionId();
            when(shortcutStore.countByCategory(GUILD)).thenReturn(List.of(
                    CategoryCount.builder().category("Fun").count(6L).build()));

            BrowserView view = browser.back(session, GUILD);

            assertThat(view.getStage()).isEqualTo(BrowserStage.CATEGORY_SELECT);
            assertThat(view.getCategories()).extracting(CategoryCount::getCount).containsExactly(6L);
        }

        @Test
        void pagingRequiresASelectedCategory() {
            String session = browser.open(GUILD).getSessionId();

            assertThatThrownBy(() -> browser.next(session, GUILD)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> browser.back(session, GUILD)).isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("each interaction restarts the idle timer")
        void interactionsKeepSessionAlive() {
            String session = openFun().getSessionId();

            clock.advance(Duration.ofSeconds(250));
            browser.next(session, GUILD);
            clock.advance(Duration.ofSeconds(250));

            assertThat(browser.previous(session, GUILD).getPage()).isEqualTo(1);
        }

        @Test
        @DisplayName("a no-op page turn still counts as an interaction")
        void noOpInteractionKeepsSessionAlive() {
            String session = openFun().getSessionId();

            clock.advance(Duration.ofSeconds(250));
            browser.previous(session, GUILD);
            clock.advance(Duration.ofSeconds(250));

            assertThat(browser.next(session, GUILD).getPage()).isEqualTo(2);
        }

        @Test
        void idleSessionRejectsInteractions() {
            String session = openFun().getSessionId();

            clock.advance(Duration.ofSeconds(300));

            assertThatThrownBy(() -> browser.next(session, GUILD))
                    .isInstanceOf(BrowserExpiredException.class);
            assertThatThrownBy(() -> browser.back(session, GUILD))
                    .isInstanceOf(BrowserExpiredException.class);
        }
    }
}
