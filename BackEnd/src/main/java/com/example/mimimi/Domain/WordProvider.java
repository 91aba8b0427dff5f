package com.example.mimimi.Domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 출제 단어와 키워드 카탈로그.
 * <p>
 * 실제 단어 DB 조회는 이 클래스 뒤에 숨긴다. 지금은 메모리 단어 풀로 동작한다.
 */
@Component
public class WordProvider {

    private static final long KEYWORD_ID_OFFSET = 1000L;

    private final Random random = new Random();

    @Getter
    @AllArgsConstructor
    public static class CatalogWord {
        private final Long id;
        private final String name;
        private final List<Long> keywordIds;
    }

    /* =========================
       단어 풀 (단어 -> 키워드)
    ========================= */
    private static final Map<String, List<String>> WORD_POOL = new LinkedHashMap<>();

    static {
        WORD_POOL.put("Apfel", List.of("rot", "rund", "Baum", "süß", "Obst"));
        WORD_POOL.put("Banane", List.of("gelb", "krumm", "Affe", "Schale", "Obst"));
        WORD_POOL.put("Hund", List.of("bellen", "Fell", "Leine", "Haustier", "Knochen"));
        WORD_POOL.put("Katze", List.of("miauen", "Fell", "Maus", "Haustier", "schnurren"));
        WORD_POOL.put("Haus", List.of("Dach", "Tür", "Fenster", "wohnen"));
        WORD_POOL.put("Auto", List.of("fahren", "Räder", "Straße", "Motor", "hupen"));
        WORD_POOL.put("Sonne", List.of("gelb", "warm", "Himmel", "Sommer", "hell"));
        WORD_POOL.put("Mond", List.of("Nacht", "rund", "Himmel", "Sterne"));
        WORD_POOL.put("Baum", List.of("Blätter", "Wald", "Ast", "grün", "Holz"));
        WORD_POOL.put("Fisch", List.of("schwimmen", "Wasser", "Flosse", "Schuppen"));
        WORD_POOL.put("Schule", List.of("lernen", "Lehrer", "Tafel", "Pause", "Heft"));
        WORD_POOL.put("Ball", List.of("rund", "spielen", "werfen", "Tor"));
        WORD_POOL.put("Buch", List.of("lesen", "Seiten", "Geschichte", "Bibliothek"));
        WORD_POOL.put("Zug", List.of("Schienen", "Bahnhof", "fahren", "Waggon", "Lok"));
        WORD_POOL.put("Schnee", List.of("weiß", "kalt", "Winter", "Schneemann", "Flocke"));
        WORD_POOL.put("Blume", List.of("Blüte", "duften", "Garten", "Biene"));
        WORD_POOL.put("Vogel", List.of("fliegen", "Federn", "Nest", "zwitschern", "Schnabel"));
        WORD_POOL.put("Kuchen", List.of("backen", "süß", "Geburtstag", "Kerzen"));
        WORD_POOL.put("Regen", List.of("nass", "Wolke", "Schirm", "Pfütze"));
        WORD_POOL.put("Uhr", List.of("Zeit", "Zeiger", "ticken", "Wecker"));
        WORD_POOL.put("Brot", List.of("Bäcker", "backen", "Scheibe", "Butter"));
        WORD_POOL.put("Schiff", List.of("Meer", "Hafen", "Kapitän", "Anker", "segeln"));
        WORD_POOL.put("Pferd", List.of("reiten", "Stall", "Mähne", "wiehern", "Hufe"));
        WORD_POOL.put("Ei", List.of("Huhn", "Schale", "Ostern", "kochen"));
        WORD_POOL.put("Maus", List.of("klein", "Käse", "piepsen", "Katze"));
        WORD_POOL.put("Bett", List.of("schlafen", "Kissen", "Decke"));
        WORD_POOL.put("Tisch", List.of("Beine", "essen"));
    }

    private final Map<Long, CatalogWord> words = new LinkedHashMap<>();
    private final Map<Long, String> keywordNames = new HashMap<>();

    public WordProvider() {
        Map<String, Long> keywordIdByName = new HashMap<>();
        long wordId = 1;

        for (Map.Entry<String, List<String>> entry : WORD_POOL.entrySet()) {
            List<Long> keywordIds = new ArrayList<>();
            for (String keyword : entry.getValue()) {
                Long keywordId = keywordIdByName.computeIfAbsent(keyword, k -> KEYWORD_ID_OFFSET + keywordIdByName.size() + 1);
                keywordNames.put(keywordId, keyword);
                keywordIds.add(keywordId);
            }
            words.put(wordId, new CatalogWord(wordId, entry.getKey(), List.copyOf(keywordIds)));
            wordId++;
        }
    }

    public Optional<CatalogWord> find(Long wordId) {
        return Optional.ofNullable(words.get(wordId));
    }

    public String keywordName(Long keywordId) {
        return keywordNames.getOrDefault(keywordId, "?");
    }

    // 키워드가 minKeywords 개 이상인 단어 (출제 후보)
    public List<Long> targetWordIds(int minKeywords) {
        return words.values().stream()
                .filter(w -> w.getKeywordIds().size() >= minKeywords)
                .map(CatalogWord::getId)
                .collect(Collectors.toList());
    }

    public List<Long> allWordIds() {
        return new ArrayList<>(words.keySet());
    }

    /* =========================
       출제 단어 선택 (게임 내 중복 방지)
    ========================= */
    public CatalogWord pickUniqueTarget(Set<Long> usedWordIds, int minKeywords) {
        List<Long> available = new ArrayList<>();
        for (Long id : targetWordIds(minKeywords)) {
            if (!usedWordIds.contains(id)) {
                available.add(id);
            }
        }

        if (available.isEmpty()) {
            throw new IllegalStateException("출제할 수 있는 단어가 부족합니다 (사용됨: " + usedWordIds.size() + ")");
        }

        return words.get(available.get(random.nextInt(available.size())));
    }

    /* =========================
       오답 보기 선택
    ========================= */
    public List<Long> pickDistractors(Long targetWordId, int count) {
        List<Long> candidates = allWordIds();
        candidates.remove(targetWordId);

        if (candidates.size() < count) {
            throw new IllegalStateException("보기로 쓸 단어가 부족합니다: 필요 " + count + ", 보유 " + candidates.size());
        }

        Collections.shuffle(candidates, random);
        return new ArrayList<>(candidates.subList(0, count));
    }

    public List<Long> shuffledKeywords(CatalogWord word, int limit) {
        List<Long> keywordIds = new ArrayList<>(word.getKeywordIds());
        Collections.shuffle(keywordIds, random);
        return new ArrayList<>(keywordIds.subList(0, Math.min(limit, keywordIds.size())));
    }
}
