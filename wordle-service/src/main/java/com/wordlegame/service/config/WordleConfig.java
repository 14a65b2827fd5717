package com.wordlegame.service.config;

import com.wordlegame.engine.AnswerPicker;
import com.wordlegame.engine.GameFactory;
import com.wordlegame.engine.HostSelectionPolicy;
import com.wordlegame.engine.WordDictionary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Builds the shared word lists and the game factory once at startup.
 */
@Slf4j
@Configuration
public class WordleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WordDictionary dictionary(WordListLoader loader,
                                 @Value("${wordle.words.answers}") String answersLocation,
                                 @Value("${wordle.words.allowed:}") String allowedLocation) {
        List<String> answers = loader.load(answersLocation);
        List<String> allowed = allowedLocation.isBlank() ? null : loader.load(allowedLocation);

        WordDictionary dictionary = WordDictionary.of(answers, allowed);
        log.info("Loaded {} answers and {} allowed guesses{}", dictionary.answerCount(),
                dictionary.allowedCount(), dictionary.isAcceptAnyGuess() ? " (any guess accepted)" : "");
        return dictionary;
    }

    @Bean
    public HostSelectionPolicy hostSelectionPolicy(@Value("${wordle.cheat.policy:fewest-hits}") String policy) {
        log.info("Cheating host policy: {}", policy);
        return HostSelectionPolicy.forName(policy);
    }

    @Bean
    public GameFactory gameFactory(WordDictionary dictionary,
                                   HostSelectionPolicy hostSelectionPolicy,
                                   @Value("${wordle.daily.salt}") String dailySalt,
                                   @Value("${wordle.cheat.allow-any-guess:false}") boolean cheatAllowAnyGuess) {
        return new GameFactory(dictionary, hostSelectionPolicy, new AnswerPicker(), dailySalt, cheatAllowAnyGuess);
    }
}
