package com.wall.application.service;

import com.wall.application.port.in.BrowseLibraryUseCase;
import com.wall.domain.model.HistoryEntry;
import com.wall.domain.model.Place;
import com.wall.domain.model.Recipe;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only reference catalogue shown next to the wall. Seed data only; there is no write path.
 */
@Service
public class LibraryService implements BrowseLibraryUseCase {

    private static final List<Recipe> RECIPES = List.of(
        new Recipe("old-fashioned", "Old Fashioned", List.of("classic", "whiskey")),
        new Recipe("negroni", "Negroni", List.of("classic", "gin")),
        new Recipe("daiquiri", "Daiquiri", List.of("rum", "sour"))
    );

    private static final List<Place> PLACES = List.of(
        new Place("favorite-local", "Your Favorite Local", "(add city)"),
        new Place("hotel-bar", "A Great Hotel Bar", "(add city)")
    );

    private static final List<HistoryEntry> HISTORY = List.of(
        new HistoryEntry("ice", "Why ice quality matters"),
        new HistoryEntry("bitters", "Bitters: the bartender's spice rack")
    );

    @Override
    public List<Recipe> recipes() {
        return RECIPES;
    }

    @Override
    public List<Place> places() {
        return PLACES;
    }

    @Override
    public List<HistoryEntry> history() {
        return HISTORY;
    }
}
