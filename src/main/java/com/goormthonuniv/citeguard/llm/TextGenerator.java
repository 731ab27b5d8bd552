package com.goormthonuniv.citeguard.llm;

public interface TextGenerator {
    /**
     * 프롬프트 한 건에 대한 텍스트 완성.
     * @throws TextGenerationException 프로바이더 미설정/호출 실패. 호출자는 잡아서 기본값으로 강등한다.
     */
    CompletionResponse generateCompletion(CompletionRequest request);
}
