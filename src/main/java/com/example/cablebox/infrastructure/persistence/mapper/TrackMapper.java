package com.example.cablebox.infrastructure.persistence.mapper;

import com.example.cablebox.domain.model.CandidateFilter;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TrackMapper {

    String TRACK_COLUMNS = "id, title, artist, album, album_artist, genre, `year`, duration_sec, path, "
            + "cover_art_id, added_at, created_at, updated_at ";

    String GENRE_KEY = "LOWER(TRIM(REGEXP_REPLACE(genre, '[[:space:]]+', ' ')))";
    String ARTIST_KEY = "LOWER(TRIM(REGEXP_REPLACE(artist, '[[:space:]]+', ' ')))";
    String ALBUM_KEY = "LOWER(TRIM(REGEXP_REPLACE(album, '[[:space:]]+', ' ')))";

    /**
     * WHERE clause for a {@link CandidateFilter}. Match keys in the filter are
     * already lower-cased and whitespace-collapsed; columns get the same
     * treatment in SQL (MySQL 8 {@code REGEXP_REPLACE}) before comparing.
     */
    String FILTER_WHERE = "<where>"
            + "<if test='filter.includeGenres != null and filter.includeGenres.size() > 0'>"
            + " AND " + GENRE_KEY + " IN "
            + "<foreach item='v' collection='filter.includeGenres' open='(' separator=',' close=')'>#{v}</foreach>"
            + "</if>"
            + "<if test='filter.excludeGenres != null and filter.excludeGenres.size() > 0'>"
            + " AND (genre IS NULL OR " + GENRE_KEY + " NOT IN "
            + "<foreach item='v' collection='filter.excludeGenres' open='(' separator=',' close=')'>#{v}</foreach>"
            + ")</if>"
            + "<if test='filter.includeArtists != null and filter.includeArtists.size() > 0'>"
            + " AND " + ARTIST_KEY + " IN "
            + "<foreach item='v' collection='filter.includeArtists' open='(' separator=',' close=')'>#{v}</foreach>"
            + "</if>"
            + "<if test='filter.excludeArtists != null and filter.excludeArtists.size() > 0'>"
            + " AND (artist IS NULL OR " + ARTIST_KEY + " NOT IN "
            + "<foreach item='v' collection='filter.excludeArtists' open='(' separator=',' close=')'>#{v}</foreach>"
            + ")</if>"
            + "<if test='filter.includeAlbums != null and filter.includeAlbums.size() > 0'>"
            + " AND " + ALBUM_KEY + " IN "
            + "<foreach item='v' collection='filter.includeAlbums' open='(' separator=',' close=')'>#{v}</foreach>"
            + "</if>"
            + "<if test='filter.excludeAlbums != null and filter.excludeAlbums.size() > 0'>"
            + " AND (album IS NULL OR " + ALBUM_KEY + " NOT IN "
            + "<foreach item='v' collection='filter.excludeAlbums' open='(' separator=',' close=')'>#{v}</foreach>"
            + ")</if>"
            + "<if test='filter.yearMin != null'> AND `year` &gt;= #{filter.yearMin}</if>"
            + "<if test='filter.yearMax != null'> AND `year` &lt;= #{filter.yearMax}</if>"
            + "<if test='filter.durationMinSec != null'> AND duration_sec &gt;= #{filter.durationMinSec}</if>"
            + "<if test='filter.durationMaxSec != null'> AND duration_sec &lt;= #{filter.durationMaxSec}</if>"
            + "<if test='filter.addedAfter != null'> AND added_at &gt;= #{filter.addedAfter}</if>"
            + "</where>";

    @Select("<script>"
            + "SELECT COUNT(1) FROM track "
            + FILTER_WHERE
            + "</script>")
    long countByFilter(@Param("filter") CandidateFilter filter);

    /** Page of matching rows in stable id order. */
    @Select("<script>"
            + "SELECT " + TRACK_COLUMNS
            + "FROM track "
            + FILTER_WHERE
            + " ORDER BY id ASC"
            + " LIMIT #{offset}, #{limit}"
            + "</script>")
    List<TrackEntity> selectPageByFilter(@Param("filter") CandidateFilter filter,
                                         @Param("offset") long offset,
                                         @Param("limit") int limit);
}
