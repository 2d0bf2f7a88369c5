package com.example.auth.api.response;

public record AccessTokenResponse(String accessToken) {

  @Override
  public String toString() {
    return "AccessTokenResponse[accessToken=***]";
  }
}
