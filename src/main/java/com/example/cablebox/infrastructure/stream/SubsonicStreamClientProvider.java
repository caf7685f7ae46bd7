package com.example.cablebox.infrastructure.stream;

import com.example.cablebox.common.config.AppSubsonicProperties;
import com.example.cablebox.common.exception.BusinessException;
import com.example.cablebox.common.exception.StationErrorCodes;
import com.example.cablebox.infrastructure.persistence.entity.NavidromeAccountEntity;
import com.example.cablebox.infrastructure.persistence.mapper.NavidromeAccountMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class SubsonicStreamClientProvider implements StreamClientProvider {

    private final NavidromeAccountMapper navidromeAccountMapper;
    private final AppSubsonicProperties subsonicProperties;

    public SubsonicStreamClientProvider(NavidromeAccountMapper navidromeAccountMapper,
                                        AppSubsonicProperties subsonicProperties) {
        this.navidromeAccountMapper = navidromeAccountMapper;
        this.subsonicProperties = subsonicProperties;
    }

    @Override
    public StreamUrlResolver forUser(Long userId) {
        NavidromeAccountEntity account = navidromeAccountMapper.selectByUserId(userId);
        if (account == null || !StringUtils.hasText(account.getBaseUrl())) {
            throw new BusinessException(StationErrorCodes.STREAM_ACCOUNT_MISSING,
                    "Music server account is not configured", "Connect a music server in settings");
        }
        return new SubsonicStreamUrlResolver(
                account.getBaseUrl(),
                account.getUsername(),
                account.getToken(),
                account.getSalt(),
                subsonicProperties.getClientName(),
                subsonicProperties.getApiVersion(),
                subsonicProperties.getResponseFormat()
        );
    }
}
